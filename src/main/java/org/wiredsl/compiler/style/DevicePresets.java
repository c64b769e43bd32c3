package org.wiredsl.compiler.style;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup of named device presets feeding the initial viewport of every screen.
 */
public final class DevicePresets {

    /** The preset used when no device is configured or the configured one is unknown. */
    public static final String DEFAULT_DEVICE = "desktop";

    private static final Map<String, DevicePreset> PRESETS = new LinkedHashMap<>();

    static {
        PRESETS.put("mobile", new DevicePreset("iPhone SE", 375, 812, "mobile", "iPhone SE (baseline mobile viewport)"));
        PRESETS.put("tablet", new DevicePreset("Tablet Portrait", 768, 1024, "tablet", "Tablet portrait viewport baseline"));
        PRESETS.put("desktop", new DevicePreset("Desktop HD", 1280, 720, "desktop", "Standard desktop viewport"));
        PRESETS.put("print", new DevicePreset("Print A4", 794, 1123, "print", "A4 portrait at 96 DPI"));
        PRESETS.put("a4", new DevicePreset("Print A4", 794, 1123, "print", "A4 alias at 96 DPI"));
    }

    private DevicePresets() {}

    /**
     * Resolves a device name, case-insensitively, falling back to the desktop preset.
     * @param device The device name. May be null.
     * @return The matching preset, never null.
     */
    public static DevicePreset resolve(String device) {
        if (device == null) return PRESETS.get(DEFAULT_DEVICE);
        return PRESETS.getOrDefault(device.toLowerCase(Locale.ROOT), PRESETS.get(DEFAULT_DEVICE));
    }

    /**
     * @param device A device name.
     * @return {@code true} if a preset with that name exists.
     */
    public static boolean isValidDevice(String device) {
        return device != null && PRESETS.containsKey(device.toLowerCase(Locale.ROOT));
    }

    /**
     * @return All presets keyed by lower-case name, in declaration order.
     */
    public static Map<String, DevicePreset> all() {
        return Collections.unmodifiableMap(PRESETS);
    }
}
