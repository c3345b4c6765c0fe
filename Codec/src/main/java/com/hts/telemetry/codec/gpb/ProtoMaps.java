package com.hts.telemetry.codec.gpb;

import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.EnumValueDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.MessageOrBuilder;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Protobuf message → nested ordered map, through descriptors.
 *
 * Field name → value; nested messages become maps, repeated fields lists, map fields
 * maps, enums their names, bytes base64 text. Unsigned 32/64-bit values are widened so
 * they never come out negative.
 */
public final class ProtoMaps {

    private ProtoMaps() {}

    public static Map<String, Object> toMap(MessageOrBuilder message) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<FieldDescriptor, Object> field : message.getAllFields().entrySet()) {
            FieldDescriptor fd = field.getKey();
            Object value = field.getValue();
            if (fd.isMapField()) {
                out.put(fd.getName(), mapField(fd, (List<?>) value));
            } else if (fd.isRepeated()) {
                List<Object> items = new ArrayList<>();
                for (Object item : (List<?>) value) {
                    items.add(convert(fd, item));
                }
                out.put(fd.getName(), items);
            } else {
                out.put(fd.getName(), convert(fd, value));
            }
        }
        return out;
    }

    private static Map<String, Object> mapField(FieldDescriptor fd, List<?> entries) {
        FieldDescriptor keyField = fd.getMessageType().findFieldByName("key");
        FieldDescriptor valueField = fd.getMessageType().findFieldByName("value");
        Map<String, Object> out = new LinkedHashMap<>();
        for (Object e : entries) {
            MessageOrBuilder entry = (MessageOrBuilder) e;
            out.put(String.valueOf(convert(keyField, entry.getField(keyField))),
                    convert(valueField, entry.getField(valueField)));
        }
        return out;
    }

    private static Object convert(FieldDescriptor fd, Object value) {
        switch (fd.getType()) {
            case MESSAGE:
            case GROUP:
                return toMap((MessageOrBuilder) value);
            case ENUM:
                return ((EnumValueDescriptor) value).getName();
            case BYTES:
                return Base64.getEncoder().encodeToString(((ByteString) value).toByteArray());
            case UINT32:
            case FIXED32:
                return unsigned((Integer) value);
            case UINT64:
            case FIXED64:
                return unsigned((Long) value);
            default:
                return value;
        }
    }

    public static long unsigned(int value) {
        return Integer.toUnsignedLong(value);
    }

    /**
     * @return the value as Long when it fits, BigInteger otherwise
     */
    public static Number unsigned(long value) {
        return value >= 0 ? Long.valueOf(value) : new BigInteger(Long.toUnsignedString(value));
    }
}
