package com.relay.keys.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;
import org.springframework.data.convert.WritingConverter;

import java.util.List;

/**
 * SQLite 没有布尔类型，布尔字段按 INTEGER 0/1 存取。
 */
public final class SqliteConverters {

    private SqliteConverters() {
    }

    public static List<Converter<?, ?>> all() {
        return List.of(IntegerToBooleanConverter.INSTANCE, BooleanToIntegerConverter.INSTANCE);
    }

    @ReadingConverter
    enum IntegerToBooleanConverter implements Converter<Integer, Boolean> {
        INSTANCE;

        @Override
        public Boolean convert(Integer source) {
            return source != 0;
        }
    }

    @WritingConverter
    enum BooleanToIntegerConverter implements Converter<Boolean, Integer> {
        INSTANCE;

        @Override
        public Integer convert(Boolean source) {
            return source ? 1 : 0;
        }
    }
}
