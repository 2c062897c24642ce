package com.fsnode.app.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.exception.ExceptionUtils;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;

/**
 * Turns a write payload into bytes.
 * <p>
 * Text is UTF-8, numbers and booleans use their decimal/literal form, dates are ISO-8601,
 * throwables are written as their stack trace, lists of scalars are concatenated and anything
 * else is serialized as JSON.
 */
public final class ContentEncoder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ContentEncoder() {}

    public static byte[] toBytes(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot write a null value");
        }
        if (value instanceof byte[] b) return b;
        if (isScalar(value)) return scalarBytes(value);

        List<?> items = null;
        if (value instanceof Collection<?> c) items = new ArrayList<>(c);
        else if (value instanceof Object[] arr) items = Arrays.asList(arr);

        if (items != null && !items.isEmpty() && items.stream().allMatch(ContentEncoder::isChunk)) {
            var out = new ByteArrayOutputStream();
            for (Object item : items) {
                out.writeBytes(item instanceof byte[] b ? b : scalarBytes(item));
            }
            return out.toByteArray();
        }

        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode value of type " + value.getClass().getName(), e);
        }
    }

    private static boolean isChunk(Object v) {
        return v instanceof byte[] || v instanceof CharSequence || v instanceof Number;
    }

    private static boolean isScalar(Object v) {
        return v instanceof CharSequence || v instanceof Number || v instanceof Boolean
                || v instanceof Date || v instanceof TemporalAccessor || v instanceof Throwable;
    }

    private static byte[] scalarBytes(Object v) {
        String text;
        if (v instanceof Date d) text = Instant.ofEpochMilli(d.getTime()).toString();
        else if (v instanceof Throwable t) text = ExceptionUtils.getStackTrace(t);
        else text = v.toString();
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
