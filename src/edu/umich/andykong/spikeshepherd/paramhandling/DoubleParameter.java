package edu.umich.andykong.spikeshepherd.paramhandling;

/**
 * Real-valued parameter bounded by (min, max]. NaN never passes validation.
 */
public class DoubleParameter implements Parameter<Double> {
    private final String key;
    private Double value;
    private final double min;
    private final double max;
    private final String description;

    public DoubleParameter(String key, double min, double max, Double value, String description) {
        this.key = key;
        this.min = min;
        this.max = max;
        this.description = description;
        if (value != null)
            setValue(value);
    }

    @Override
    public String getKey() {
        return this.key;
    }

    @Override
    public Double getValue() {
        return this.value;
    }

    @Override
    public void setValue(Double value) {
        if (value == null || !isValid(value)) {
            throw new InvalidParameterException(this.key,
                    String.format("value %s out of bounds (%s, %s]", value, min, max));
        }
        this.value = value;
    }

    @Override
    public void parseValue(String value) {
        try {
            setValue(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(this.key, "not a number: [" + value + "]", e);
        }
    }

    @Override
    public boolean isValid(Double value) {
        return ((value > this.min) && (value <= this.max));
    }

    @Override
    public boolean isSet() {
        return this.value != null;
    }

    @Override
    public String getDescription() {
        return description;
    }
}
