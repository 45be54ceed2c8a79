package com.ryuqq.multisig.core.model;

import java.math.BigInteger;

/**
 * 풀에서 이동하는 가치(value)의 양.
 *
 * <p>단일 자산만 다루므로 통화 단위는 없으며, 최소 단위 정수로 표현합니다.</p>
 *
 * <p><strong>불변식:</strong> 항상 0 이상 (음수 불가)</p>
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
public final class Amount implements Comparable<Amount> {

    /**
     * 0.
     */
    public static final Amount ZERO = new Amount(BigInteger.ZERO);

    private final BigInteger value;

    private Amount(BigInteger value) {
        if (value == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * Amount 생성.
     *
     * @param value 0 이상의 정수
     * @return Amount 인스턴스
     * @throws IllegalArgumentException null이거나 음수인 경우
     */
    public static Amount of(BigInteger value) {
        return new Amount(value);
    }

    /**
     * Amount 생성.
     *
     * @param value 0 이상의 정수
     * @return Amount 인스턴스
     * @throws IllegalArgumentException 음수인 경우
     */
    public static Amount of(long value) {
        return new Amount(BigInteger.valueOf(value));
    }

    public Amount plus(Amount other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return new Amount(value.add(other.value));
    }

    /**
     * 차감.
     *
     * @param other 차감할 양
     * @return 차감 결과
     * @throws IllegalArgumentException other가 null이거나 결과가 음수가 되는 경우
     */
    public Amount minus(Amount other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        return new Amount(value.subtract(other.value));
    }

    public boolean isLessThan(Amount other) {
        return compareTo(other) < 0;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public int compareTo(Amount other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Amount amount = (Amount) o;
        return value.equals(amount.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
