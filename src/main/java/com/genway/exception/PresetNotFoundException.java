package com.genway.exception;

public class PresetNotFoundException extends ConfigurationException {

    private final String presetName;

    public PresetNotFoundException(String presetName) {
        super("Preset '" + presetName + "' not found");
        this.presetName = presetName;
    }

    public String getPresetName() {
        return presetName;
    }
}
