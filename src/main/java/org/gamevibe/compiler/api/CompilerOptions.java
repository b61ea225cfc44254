package org.gamevibe.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;

/**
 * Immutable options of a compilation request.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * gdl.compiler {
 *   optimize = false
 *   source-map = false
 *   debug = false
 *   runtime-module-root = "./core"
 *   asset-properties = [sprite, image, texture, sound, music, background, tilemap]
 * }
 * </pre>
 *
 * @param optimize Accepted for API compatibility; code generation does not optimize.
 * @param sourceMap Whether to record a mapping from generated lines to declarations.
 * @param debug Whether to annotate the generated code with source positions.
 * @param runtimeModuleRoot The module path the generated imports are resolved against.
 * @param assetProperties Property names whose string values are reported as assets.
 */
public record CompilerOptions(
        boolean optimize,
        boolean sourceMap,
        boolean debug,
        String runtimeModuleRoot,
        List<String> assetProperties
) {

    /** The configuration path of the compiler block. */
    public static final String CONFIG_PATH = "gdl.compiler";

    public CompilerOptions {
        assetProperties = List.copyOf(assetProperties);
    }

    /**
     * Returns the options defined by the classpath configuration ({@code reference.conf}
     * overlaid by {@code application.conf} and system properties).
     * @return The default options.
     */
    public static CompilerOptions defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Reads the options from the {@code gdl.compiler} block of the given configuration.
     * @param config The application configuration.
     * @return The configured options.
     * @throws com.typesafe.config.ConfigException if a required key is missing or mistyped.
     */
    public static CompilerOptions fromConfig(Config config) {
        Config compiler = config.getConfig(CONFIG_PATH);
        return new CompilerOptions(
                compiler.getBoolean("optimize"),
                compiler.getBoolean("source-map"),
                compiler.getBoolean("debug"),
                compiler.getString("runtime-module-root"),
                compiler.getStringList("asset-properties"));
    }

    public CompilerOptions withOptimize(boolean value) {
        return new CompilerOptions(value, sourceMap, debug, runtimeModuleRoot, assetProperties);
    }

    public CompilerOptions withSourceMap(boolean value) {
        return new CompilerOptions(optimize, value, debug, runtimeModuleRoot, assetProperties);
    }

    public CompilerOptions withDebug(boolean value) {
        return new CompilerOptions(optimize, sourceMap, value, runtimeModuleRoot, assetProperties);
    }
}
