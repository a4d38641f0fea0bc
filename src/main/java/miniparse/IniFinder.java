package miniparse;

import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Optional;

public class IniFinder {

    private static final Logger log = LoggerFactory.getLogger(IniFinder.class);

    private final LineClassifier classifier;

    public IniFinder() {
        this(new LineClassifier());
    }

    public IniFinder(@NonNull LineClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Without a section, headers are ignored and the first {@code key} anywhere wins, even inside a named section.
     * With one, the search stops at the first header after that section.
     */
    public Optional<String> find(String text, @NonNull String key, String section) {
        Iterator<String> lines = LineClassifier.lines(text).iterator();
        return section == null ? findAnywhere(lines, key) : findInSection(lines, key, section);
    }

    private Optional<String> findAnywhere(Iterator<String> lines, String key) {
        while (lines.hasNext()) {
            ClassifiedLine line = classifier.classify(lines.next());
            switch (line.getKind()) {
                case KEY_VALUE:
                    if (key.equals(line.key())) {
                        return Optional.of(line.value());
                    }
                    break;
                case UNPARSABLE:
                    log.warn("Skipping unparsable non-empty line: {}", line.getText());
                    break;
                default:
                    break;
            }
        }
        return Optional.empty();
    }

    private Optional<String> findInSection(Iterator<String> lines, String key, String section) {
        boolean inside = false;
        while (lines.hasNext()) {
            ClassifiedLine line = classifier.classify(lines.next());
            switch (line.getKind()) {
                case SECTION_HEADER:
                    if (inside) {
                        log.debug("Section [{}] ended without key '{}'", section, key);
                        return Optional.empty();
                    }
                    inside = section.equals(line.sectionName());
                    break;
                case KEY_VALUE:
                    if (inside && key.equals(line.key())) {
                        return Optional.of(line.value());
                    }
                    break;
                case UNPARSABLE:
                    log.warn("Skipping unparsable non-empty line: {}", line.getText());
                    break;
                default:
                    break;
            }
        }
        return Optional.empty();
    }
}
