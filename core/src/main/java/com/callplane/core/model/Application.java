package com.callplane.core.model;

import com.callplane.core.util.ResourceIds;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * A Stasis application known to the dispatcher.
 * <p>
 * The uuid is derived from the application name, so the same name always
 * maps to the same uuid on every replica.
 * </p>
 */
@Value
public class Application {
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");

    String name;
    String uuid;

    public static Application fromName(String name) {
        if (!isValid(name)) {
            throw new IllegalArgumentException("Invalid application name: " + name);
        }
        return new Application(name, ResourceIds.fromName(name));
    }

    /**
     * Tests whether a name can be used as an application name: 1 to 128 characters,
     * letters, digits, {@code _ . -}, starting with a letter or digit.
     *
     * @param name candidate name, may be null
     * @return true if the name is acceptable
     */
    public static boolean isValid(String name) {
        return name != null && VALID_NAME.matcher(name).matches();
    }
}
