package com.rentnest.tm30.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DataMaskingUtilTest {

    @Test
    void shouldKeepLastThreePassportCharacters() {
        assertThat(DataMaskingUtil.maskPassportNumber("AB1234567")).isEqualTo("******567");
        assertThat(DataMaskingUtil.maskPassportNumber("AB1")).isEqualTo("***");
        assertThat(DataMaskingUtil.maskPassportNumber(null)).isNull();
    }

    @Test
    void shouldMaskEmailLocalPart() {
        assertThat(DataMaskingUtil.maskEmail("contact john.doe@example.com now"))
                .isEqualTo("contact j***@example.com now");
    }

    @Test
    void shouldMaskCredentialQueryParameters() {
        assertThat(DataMaskingUtil.maskCredentials("page=1&token=abc123&api_key=xyz"))
                .isEqualTo("page=1&token=***&api_key=***");
    }

    @Test
    void shouldMaskPhoneNumbersKeepingLastDigits() {
        assertThat(DataMaskingUtil.maskPhone("+66812345678")).isEqualTo("***678");
    }
}
