package org.docstore.entity;

import jakarta.persistence.AttributeConverter;
import org.docstore.exception.ValidationException;

import java.util.Locale;

/**
 * 内容变更来源，数据库中以小写存储
 */
public enum ChangeSource {
    WEB, API, WEBDAV;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChangeSource fromValue(String value) {
        if (value == null) {
            throw new ValidationException("Change source is required");
        }
        for (ChangeSource source : values()) {
            if (source.value().equalsIgnoreCase(value.trim())) {
                return source;
            }
        }
        throw new ValidationException("Unknown change source: " + value);
    }

    @jakarta.persistence.Converter
    public static class Converter implements AttributeConverter<ChangeSource, String> {

        @Override
        public String convertToDatabaseColumn(ChangeSource attribute) {
            return attribute == null ? null : attribute.value();
        }

        @Override
        public ChangeSource convertToEntityAttribute(String dbData) {
            return dbData == null ? null : fromValue(dbData);
        }
    }
}
