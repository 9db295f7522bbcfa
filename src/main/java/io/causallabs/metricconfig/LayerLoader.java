package io.causallabs.metricconfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads definition files (TOML or JSON) into layers. */
public final class LayerLoader {

    private LayerLoader() {}

    public static Layer load(Path file) throws ConfigException {
        return load(file, stripExtension(file.getFileName().toString()));
    }

    /** Load a file under the given layer name */
    public static Layer load(Path file, String name) throws ConfigException {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException(ErrorKind.LOAD_FAILURE, "Error reading " + file, e);
        }
        logger.debug("Loaded layer {} from {}", name, file);
        if (file.getFileName().toString().endsWith(".json"))
            return Layer.fromJson(name, text);
        return Layer.fromToml(name, text);
    }

    /** Load a TOML layer bundled on the classpath */
    public static Layer loadResource(String resource) throws ConfigException {
        try (InputStream in = LayerLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigException(ErrorKind.LOAD_FAILURE,
                        "Resource " + resource + " not found on the classpath");
            }
            String name = resource.substring(resource.lastIndexOf('/') + 1);
            return Layer.fromToml(stripExtension(name),
                    new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigException(ErrorKind.LOAD_FAILURE, "Error reading " + resource, e);
        }
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static final Logger logger = LoggerFactory.getLogger(LayerLoader.class);
}
