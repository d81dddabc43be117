package com.slb.staking_backend.modules.credential.service;

import com.slb.staking_backend.common.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WithdrawalCredentialsTest {

    @Test
    void forAddress_layoutIsPrefixZerosAddress() {
        byte[] credentials = WithdrawalCredentials.forAddress(1, "0x71C7656EC7ab88b098defB751B7401B5f6d8976F");

        assertThat(credentials).hasSize(32);
        assertThat(HexFormat.of().formatHex(credentials))
                .isEqualTo("01" + "0000000000000000000000" + "71c7656ec7ab88b098defb751b7401b5f6d8976f");
    }

    @Test
    void forAddress_rejectsBadAddress() {
        assertThatThrownBy(() -> WithdrawalCredentials.forAddress(1, "0x1234"))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ValidationException.INVALID_ADDRESS);
    }

    @Test
    void forAddress_rejectsPrefixOutsideOneByte() {
        assertThatThrownBy(() -> WithdrawalCredentials.forAddress(256, "0x71c7656ec7ab88b098defb751b7401b5f6d8976f"))
                .isInstanceOf(ValidationException.class);
    }
}
