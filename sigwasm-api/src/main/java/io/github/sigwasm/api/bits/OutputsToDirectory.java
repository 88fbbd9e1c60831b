package io.github.sigwasm.api.bits;

import io.github.sigwasm.api.CompiledComponent;
import io.github.sigwasm.api.SignalCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A bit which writes every emitted component to a directory, as {@code <name>.wasm},
 * {@code <name>.html} and {@code <name>.hydration.json}.
 */
public class OutputsToDirectory implements Bit<Void> {
    private static final Logger LOGGER = LoggerFactory.getLogger(OutputsToDirectory.class);

    private final Path directory;

    /**
     * Construct a {@link OutputsToDirectory} for outputting to the given directory.
     *
     * @param directory The directory to write outputs to.
     */
    public OutputsToDirectory(Path directory) {
        this.directory = directory;
    }

    @Override
    public Void addTo(SignalCompiler cc) {
        cc.lift().onEmit(evt -> {
            CompiledComponent component = evt.component;
            try {
                Files.createDirectories(directory);
                Files.write(directory.resolve(evt.name + ".wasm"), component.getWasm());
                Files.write(directory.resolve(evt.name + ".html"),
                        component.getHtml().getBytes(StandardCharsets.UTF_8));
                Files.write(directory.resolve(evt.name + ".hydration.json"),
                        component.getManifest().toJson().getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            LOGGER.debug("wrote {} to {}", evt.name, directory);
        });
        return null;
    }
}
