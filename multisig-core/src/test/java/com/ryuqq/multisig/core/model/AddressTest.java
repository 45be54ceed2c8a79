package com.ryuqq.multisig.core.model;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Address Value Object 테스트.
 *
 * @author MultiSig Team
 * @since 1.0.0
 */
class AddressTest {

    private static final String VALID = "0x52908400098527886e0f7030069857d2e4169ee7";

    @Test
    void of_ValidValue_CreatesAddress() {
        // When
        Address address = Address.of(VALID);

        // Then
        assertEquals(VALID, address.getValue());
        assertFalse(address.isZero());
    }

    @Test
    void of_MixedCase_NormalizesToLowerCase() {
        // Given
        String checksummed = "0x52908400098527886E0F7030069857D2E4169EE7";

        // When
        Address address = Address.of(checksummed);

        // Then
        assertEquals(VALID, address.getValue());
        assertEquals(Address.of(VALID), address);
        assertEquals(Address.of(VALID).hashCode(), address.hashCode());
    }

    @Test
    void of_SurroundingWhitespace_IsTrimmed() {
        assertEquals(Address.of(VALID), Address.of("  " + VALID + " "));
    }

    @Test
    void of_NullValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Address.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Address.of("   "));
    }

    @Test
    void of_MissingPrefix_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Address.of(VALID.substring(2))
        );
        assertTrue(exception.getMessage().contains("40 hex characters"));
    }

    @Test
    void of_WrongLength_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Address.of(VALID + "0"));
        assertThrows(IllegalArgumentException.class, () -> Address.of(VALID.substring(0, 41)));
    }

    @Test
    void of_NonHexCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Address.of("0x" + "g".repeat(40)));
    }

    @Test
    void zero_IsZero() {
        assertTrue(Address.ZERO.isZero());
        assertTrue(Address.of("0x" + "0".repeat(40)).isZero());
        assertEquals(Address.ZERO, Address.of("0x" + "0".repeat(40)));
    }

    @Test
    void toString_ReturnsNormalizedValue() {
        assertEquals(VALID, Address.of(VALID.toUpperCase().replace("0X", "0x")).toString());
    }

    @Test
    void of_UpperCaseUnderTurkishLocale_NormalizesIndependentlyOfLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Address address = Address.of("0X52908400098527886E0F7030069857D2E4169EE7");

            assertEquals(VALID, address.getValue());
            assertEquals(Address.of(VALID), address);
        } finally {
            Locale.setDefault(previous);
        }
    }
}
