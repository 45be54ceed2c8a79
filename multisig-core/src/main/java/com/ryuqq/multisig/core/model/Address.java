package com.ryuqq.multisig.core.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 주체(Principal) 식별자.
 *
 * <p>Owner, 수신자(recipient), 입금자(sender), 지갑 풀 자체를 모두 Address로 식별합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>형식: {@code 0x} + 16진수 40자</li>
 *   <li>소문자로 정규화 (대소문자만 다른 두 Address는 동일)</li>
 * </ul>
 *
 * <p>{@link #ZERO}는 "null 주체"를 나타내며, Owner나 수신자로 사용할 수 없습니다.</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public final class Address {

    private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-f]{40}$");

    /**
     * Zero Address ({@code 0x0000000000000000000000000000000000000000}).
     */
    public static final Address ZERO = new Address("0x" + "0".repeat(40));

    private final String value;

    private Address(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Address cannot be null or blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (!FORMAT.matcher(normalized).matches()) {
            throw new IllegalArgumentException(
                "Address must be 0x followed by 40 hex characters (current: " + value + ")"
            );
        }
        this.value = normalized;
    }

    /**
     * Address 생성.
     *
     * @param value 0x 접두사를 포함한 16진수 문자열
     * @return Address 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Address of(String value) {
        return new Address(value);
    }

    /**
     * Zero Address 여부 확인.
     *
     * @return Zero Address인 경우 true
     */
    public boolean isZero() {
        return this.equals(ZERO);
    }

    /**
     * 정규화된 Address 값 조회.
     *
     * @return 소문자 0x 문자열
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Address address = (Address) o;
        return value.equals(address.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
