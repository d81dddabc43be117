package com.slb.staking_backend.common.util;

import com.slb.staking_backend.common.exception.ValidationException;
import org.springframework.util.StringUtils;

import java.util.HexFormat;
import java.util.Locale;

/**
 * 0x 十六进制与 EVM 地址的解析/规范化工具。地址统一存储为小写 0x + 40 位十六进制。
 */
public final class HexUtils {

    private static final HexFormat HEX = HexFormat.of();
    private static final int ADDRESS_HEX_LENGTH = 40;

    private HexUtils() {
    }

    public static byte[] decode(String field, String value) {
        if (!StringUtils.hasText(value)) {
            throw new ValidationException(ValidationException.VALIDATION_ERROR, field, field + " is required");
        }
        String hex = strip0x(value.trim());
        if (hex.length() % 2 != 0) {
            throw new ValidationException(ValidationException.VALIDATION_ERROR, field, field + " has an odd number of hex digits");
        }
        try {
            return HEX.parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ValidationException.VALIDATION_ERROR, field, field + " is not valid hex");
        }
    }

    public static String encode(byte[] bytes) {
        return bytes == null ? null : "0x" + HEX.formatHex(bytes);
    }

    public static String normalizeAddress(String field, String address) {
        if (!StringUtils.hasText(address)) {
            throw new ValidationException(ValidationException.INVALID_ADDRESS, field, field + " is required");
        }
        String trimmed = address.trim();
        if (!trimmed.startsWith("0x") && !trimmed.startsWith("0X")) {
            throw new ValidationException(ValidationException.INVALID_ADDRESS, field, field + " must start with 0x");
        }
        String hex = trimmed.substring(2);
        if (hex.length() != ADDRESS_HEX_LENGTH || !hex.chars().allMatch(HexFormat::isHexDigit)) {
            throw new ValidationException(ValidationException.INVALID_ADDRESS, field,
                    field + " must be 20 bytes (40 hex chars)");
        }
        return "0x" + hex.toLowerCase(Locale.ROOT);
    }

    public static byte[] addressBytes(String address) {
        return HEX.parseHex(strip0x(normalizeAddress("address", address)));
    }

    /**
     * 地址比较：大小写不敏感，null 不等于任何地址。
     */
    public static boolean sameAddress(String a, String b) {
        return a != null && b != null && a.equalsIgnoreCase(b);
    }

    private static String strip0x(String value) {
        return value.startsWith("0x") || value.startsWith("0X") ? value.substring(2) : value;
    }
}
