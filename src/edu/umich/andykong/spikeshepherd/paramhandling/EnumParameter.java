package edu.umich.andykong.spikeshepherd.paramhandling;

import java.util.Arrays;
import java.util.Locale;

/**
 * Parameter restricted to the constants of an enum. Parsing is case-insensitive.
 */
public class EnumParameter<E extends Enum<E>> implements Parameter<E> {
    private final String key;
    private final Class<E> type;
    private E value;
    private final String description;

    public EnumParameter(String key, Class<E> type, E value, String description) {
        this.key = key;
        this.type = type;
        this.value = value;
        this.description = description;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public E getValue() {
        return value;
    }

    @Override
    public void setValue(E value) throws InvalidParameterException {
        if (!isValid(value))
            throw new InvalidParameterException(key, "value must not be null");
        this.value = value;
    }

    @Override
    public void parseValue(String value) throws InvalidParameterException {
        try {
            setValue(Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException(key, String.format("unsupported value [%s], expected one of %s",
                    value, Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT)), e);
        }
    }

    @Override
    public boolean isValid(E value) {
        return value != null;
    }

    @Override
    public boolean isSet() {
        return value != null;
    }

    @Override
    public String getDescription() {
        return description;
    }
}
