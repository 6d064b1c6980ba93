package edu.umich.andykong.spikeshepherd.paramhandling;

public interface Parameter<T> {
    String getKey();
    T getValue();
    void setValue(T value) throws InvalidParameterException;
    void parseValue(String value) throws InvalidParameterException;
    boolean isValid(T value);
    boolean isSet();
    String getDescription();

}
