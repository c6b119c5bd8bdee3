package com.payments.engine.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

class AmountsTest {

    @Test
    void testRoundForDisplay_MoreThanFourPlaces_RoundsHalfEven() {
        assertThat(Amounts.roundForDisplay(new BigDecimal("2.00005"))).isEqualTo(new BigDecimal("2.0000"));
        assertThat(Amounts.roundForDisplay(new BigDecimal("2.00015"))).isEqualTo(new BigDecimal("2.0002"));
        assertThat(Amounts.roundForDisplay(new BigDecimal("-1.23456"))).isEqualTo(new BigDecimal("-1.2346"));
    }

    @Test
    void testRoundForDisplay_FourPlacesOrFewer_Unchanged() {
        // no zero padding: 100.0 stays 100.0
        assertThat(Amounts.roundForDisplay(new BigDecimal("100.0"))).isEqualTo(new BigDecimal("100.0"));
        assertThat(Amounts.roundForDisplay(new BigDecimal("1.2345"))).isEqualTo(new BigDecimal("1.2345"));
        assertThat(Amounts.roundForDisplay(BigDecimal.ZERO)).isSameAs(BigDecimal.ZERO);
    }

    @Test
    void testRoundForDisplay_CustomScale() {
        assertThat(Amounts.roundForDisplay(new BigDecimal("1.255"), 2)).isEqualTo(new BigDecimal("1.26"));
    }

    @Test
    void testIsPositive() {
        assertThat(Amounts.isPositive(new BigDecimal("0.0001"))).isTrue();
        assertThat(Amounts.isPositive(new BigDecimal("0.0000"))).isFalse();
        assertThat(Amounts.isPositive(new BigDecimal("-3"))).isFalse();
        assertThat(Amounts.isPositive(null)).isFalse();
    }

    @Test
    void testIsLessThan_IgnoresScale() {
        assertThat(Amounts.isLessThan(new BigDecimal("100.0"), new BigDecimal("100.00"))).isFalse();
        assertThat(Amounts.isLessThan(new BigDecimal("99.99"), new BigDecimal("100"))).isTrue();
    }
}
