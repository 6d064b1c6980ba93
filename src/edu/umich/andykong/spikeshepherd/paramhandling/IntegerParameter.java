package edu.umich.andykong.spikeshepherd.paramhandling;

public class IntegerParameter implements Parameter<Integer> {
    private final String key;
    private int value;
    private final int min;
    private final int max;
    private final int defaultValue;
    private final String description;

    public IntegerParameter(String key, int min, int max, int value, String description) {
        this.key = key;
        this.min = min;
        this.max = max;
        this.description = description;
        setValue(value);
        this.defaultValue = value;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public Integer getValue() {
        return value;
    }

    public int getDefaultValue() {
        return defaultValue;
    }

    @Override
    public void setValue(Integer value) throws InvalidParameterException {
        if (value == null || !isValid(value)) {
            throw new InvalidParameterException(this.key,
                    String.format("received an invalid argument %s, expected [%d, %d]", value, min, max));
        }
        this.value = value;
    }

    @Override
    public void parseValue(String value) throws InvalidParameterException {
        try {
            setValue(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(this.key, "not an integer: [" + value + "]", e);
        }
    }

    @Override
    public boolean isValid(Integer value) {
        return ((value >= min) && (value <= max));
    }

    @Override
    public boolean isSet() {
        return true;
    }

    @Override
    public String getDescription() {
        return description;
    }

}
