package com.teamA.cra.common.ddb;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * low-level AttributeValue 변환 모음
 *
 * - 자유형 필드(attributes, payload)는 재귀적으로 M / L 로 저장
 * - 숫자는 long으로 표현 가능하면 Long, 아니면 BigDecimal로 돌려준다
 */
public final class AttributeValues {

    private AttributeValues() {
        // util class
    }

    public static AttributeValue s(String value) {
        return AttributeValue.builder().s(value).build();
    }

    public static AttributeValue n(long value) {
        return AttributeValue.builder().n(Long.toString(value)).build();
    }

    public static AttributeValue bool(boolean value) {
        return AttributeValue.builder().bool(value).build();
    }

    public static AttributeValue nul() {
        return AttributeValue.builder().nul(true).build();
    }

    public static AttributeValue list(List<AttributeValue> values) {
        return AttributeValue.builder().l(values).build();
    }

    public static AttributeValue map(Map<String, AttributeValue> values) {
        return AttributeValue.builder().m(values).build();
    }

    /** 값이 있을 때만 put (빈 문자열은 저장하지 않음) */
    public static void putIfPresent(Map<String, AttributeValue> item, String name, String value) {
        if (value != null && !value.isEmpty()) {
            item.put(name, s(value));
        }
    }

    public static void putIfPresent(Map<String, AttributeValue> item, String name, Long value) {
        if (value != null) {
            item.put(name, n(value));
        }
    }

    public static String string(Map<String, AttributeValue> item, String name) {
        AttributeValue v = item.get(name);
        return v == null ? null : v.s();
    }

    public static Long number(Map<String, AttributeValue> item, String name) {
        AttributeValue v = item.get(name);
        if (v == null || v.n() == null) return null;
        return Long.parseLong(v.n());
    }

    public static long number(Map<String, AttributeValue> item, String name, long defaultValue) {
        Long v = number(item, name);
        return v == null ? defaultValue : v;
    }

    public static boolean bool(Map<String, AttributeValue> item, String name, boolean defaultValue) {
        AttributeValue v = item.get(name);
        if (v == null || v.bool() == null) return defaultValue;
        return v.bool();
    }

    public static AttributeValue toAttrValue(Object raw) {
        if (raw == null) {
            return nul();
        }
        if (raw instanceof AttributeValue v) {
            return v;
        }
        if (raw instanceof String v) {
            return s(v);
        }
        if (raw instanceof Boolean v) {
            return bool(v);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return n(((Number) raw).longValue());
        }
        if (raw instanceof Number v) {
            return AttributeValue.builder().n(new BigDecimal(v.toString()).toPlainString()).build();
        }
        if (raw instanceof Enum<?> e) {
            return s(e.toString());
        }
        if (raw instanceof Map<?, ?> m) {
            Map<String, AttributeValue> converted = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet()) {
                converted.put(String.valueOf(e.getKey()), toAttrValue(e.getValue()));
            }
            return map(converted);
        }
        if (raw instanceof Collection<?> c) {
            List<AttributeValue> converted = new ArrayList<>(c.size());
            for (Object o : c) {
                converted.add(toAttrValue(o));
            }
            return list(converted);
        }

        throw new IllegalArgumentException(
                "Unsupported attribute type: " + raw.getClass()
        );
    }

    public static Object fromAttrValue(AttributeValue v) {
        if (v == null || Boolean.TRUE.equals(v.nul())) {
            return null;
        }
        if (v.s() != null) {
            return v.s();
        }
        if (v.n() != null) {
            BigDecimal d = new BigDecimal(v.n());
            try {
                return d.longValueExact();
            } catch (ArithmeticException e) {
                return d;
            }
        }
        if (v.bool() != null) {
            return v.bool();
        }
        if (v.hasM()) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<String, AttributeValue> e : v.m().entrySet()) {
                out.put(e.getKey(), fromAttrValue(e.getValue()));
            }
            return out;
        }
        if (v.hasL()) {
            List<Object> out = new ArrayList<>(v.l().size());
            for (AttributeValue e : v.l()) {
                out.add(fromAttrValue(e));
            }
            return out;
        }
        if (v.hasSs()) {
            return new ArrayList<>(v.ss());
        }

        throw new IllegalArgumentException("Unsupported attribute value: " + v);
    }

    public static Map<String, Object> fromAttrMap(Map<String, AttributeValue> m) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (m == null) return out;
        for (Map.Entry<String, AttributeValue> e : m.entrySet()) {
            out.put(e.getKey(), fromAttrValue(e.getValue()));
        }
        return out;
    }
}
