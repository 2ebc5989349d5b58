package com.java.vidigal.deepl.request;

/**
 * A {@link TranslateOption} that sets one named parameter to one value, or removes the parameter
 * when the value is empty.
 *
 * @param name  the wire parameter name
 * @param value the encoded value
 */
record ParameterOption(String name, String value) implements TranslateOption {

    @Override
    public void apply(FormParameters parameters) {
        if (value.isEmpty()) {
            parameters.remove(name);
        } else {
            parameters.set(name, value);
        }
    }
}
