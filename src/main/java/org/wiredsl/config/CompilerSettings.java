package org.wiredsl.config;

import com.typesafe.config.Config;
import org.wiredsl.compiler.backend.layout.LayoutOptions;
import org.wiredsl.compiler.style.DevicePresets;

/**
 * Typed view of the {@code wiredsl} configuration block.
 *
 * @param defaultDevice       Device preset used when a project style names none.
 * @param splitSidebarWidth   Fixed panel width of a split without width parameters.
 * @param imageFallbackHeight Image height when no aspect ratio can be derived.
 */
public record CompilerSettings(String defaultDevice, int splitSidebarWidth, int imageFallbackHeight) {

    public CompilerSettings {
        if (!DevicePresets.isValidDevice(defaultDevice)) {
            throw new IllegalArgumentException("Unknown default device: " + defaultDevice);
        }
        if (splitSidebarWidth <= 0) {
            throw new IllegalArgumentException("split-sidebar-width must be positive, was " + splitSidebarWidth);
        }
        if (imageFallbackHeight <= 0) {
            throw new IllegalArgumentException("image-fallback-height must be positive, was " + imageFallbackHeight);
        }
    }

    public static CompilerSettings defaults() {
        LayoutOptions layout = LayoutOptions.defaults();
        return new CompilerSettings(DevicePresets.DEFAULT_DEVICE, (int) layout.splitSidebarWidth(),
            (int) layout.imageFallbackHeight());
    }

    /**
     * Reads the settings from a resolved configuration.
     *
     * @param config The root configuration, as returned by {@link ConfigLoader#load()}.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static CompilerSettings fromConfig(Config config) {
        Config root = config.getConfig("wiredsl");
        return new CompilerSettings(
            root.getString("compiler.default-device"),
            root.getInt("layout.split-sidebar-width"),
            root.getInt("layout.image-fallback-height"));
    }

    public LayoutOptions layoutOptions() {
        return new LayoutOptions(splitSidebarWidth, imageFallbackHeight);
    }
}
