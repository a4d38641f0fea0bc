package miniparse.cli;

import ch.qos.logback.classic.Level;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Verbosity {
    WARNINGS(Level.WARN),
    SILENT(Level.OFF),
    DEBUG(Level.DEBUG);

    private final Level level;
}
