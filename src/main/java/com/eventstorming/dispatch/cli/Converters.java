package com.eventstorming.dispatch.cli;

import com.eventstorming.core.model.DetailLevel;
import com.eventstorming.core.model.ElementType;
import com.eventstorming.core.model.WorkshopValidationException;
import com.eventstorming.dispatch.render.OutputFormat;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Case-insensitive picocli converters for the CLI's enum options.
 */
public final class Converters {

    private Converters() {
        // holder
    }

    public static class ElementTypeConverter implements ITypeConverter<ElementType> {
        @Override
        public ElementType convert(String value) {
            try {
                return ElementType.fromWireName(value);
            } catch (WorkshopValidationException e) {
                throw new TypeConversionException(e.getMessage() + " (expected one of: "
                        + Arrays.stream(ElementType.values()).map(ElementType::wireName)
                                .collect(Collectors.joining(", ")) + ")");
            }
        }
    }

    public static class DetailLevelConverter implements ITypeConverter<DetailLevel> {
        @Override
        public DetailLevel convert(String value) {
            return parse(DetailLevel.class, value);
        }
    }

    public static class OutputFormatConverter implements ITypeConverter<OutputFormat> {
        @Override
        public OutputFormat convert(String value) {
            return parse(OutputFormat.class, value);
        }
    }

    static <E extends Enum<E>> E parse(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException("'" + value + "' is not one of "
                    + Arrays.stream(type.getEnumConstants())
                            .map(c -> c.name().toLowerCase(Locale.ROOT))
                            .collect(Collectors.joining(", ")));
        }
    }
}
