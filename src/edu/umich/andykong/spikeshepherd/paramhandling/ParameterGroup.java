package edu.umich.andykong.spikeshepherd.paramhandling;

import java.util.LinkedHashMap;
import java.util.Map;

public class ParameterGroup {
    private final String name;
    private final Map<String, Parameter<?>> parameters;

    public ParameterGroup(String name) {
        this.name = name;
        this.parameters = new LinkedHashMap<>();
    }

    public String getName() {
        return name;
    }

    public void addParam(Parameter<?> parameter) {
        if (parameters.containsKey(parameter.getKey()))
            throw new IllegalArgumentException("Parameter already exists: " + parameter.getKey());
        parameters.put(parameter.getKey(), parameter);
    }

    public Parameter<?> getParam(String key) {
        Parameter<?> parameter = parameters.get(key);
        if (parameter == null)
            throw new InvalidParameterException(key, "unknown parameter in group " + name);
        return parameter;
    }

    @SuppressWarnings("unchecked")
    public <T> T getParamValue(String key) {
        return (T) getParam(key).getValue();
    }

    @SuppressWarnings("unchecked")
    public <T> void setParamValue(String key, T value) {
        Parameter<T> parameter = (Parameter<T>) getParam(key);
        parameter.setValue(value);
    }

    public void parseParamValue(String key, String value) {
        if (value == null)
            throw new InvalidParameterException(key, "missing value");
        getParam(key).parseValue(value);
    }

    /**
     * Fails on the first parameter that has neither a default nor an assigned value.
     */
    public void checkRequired() {
        for (Parameter<?> parameter : parameters.values()) {
            if (!parameter.isSet())
                throw new InvalidParameterException(parameter.getKey(), "required parameter is not set");
        }
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Group: ").append(name);
        parameters.forEach((key, parameter) -> sb.append("\n").append(key).append(" = ").append(parameter.getValue()));
        return sb.toString();
    }
}
