package com.dcruver.ideatree.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a classified note asks the tree to do.
 */
public enum Action {
    ADD,
    DELETE,
    REMIND;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Read the action string emitted by the model. Anything unrecognised is an add.
     */
    public static Action fromWire(String value) {
        if (value == null) {
            return ADD;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "delete", "remove", "eliminar", "borrar" -> DELETE;
            case "remind", "reminder", "recordatorio" -> REMIND;
            default -> ADD;
        };
    }
}
