package miniparse;

import lombok.NonNull;
import miniparse.builders.IniFileBuilder;
import miniparse.builders.SectionBuilder;
import miniparse.models.Entry;
import miniparse.models.IniFile;
import miniparse.models.SectionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;

public class IniParser {

    private static final Logger log = LoggerFactory.getLogger(IniParser.class);

    private final LineClassifier classifier;

    public IniParser() {
        this(new LineClassifier());
    }

    public IniParser(@NonNull LineClassifier classifier) {
        this.classifier = classifier;
    }

    public IniFile parse(String text) {
        IniFileBuilder fileBuilder = new IniFileBuilder();
        SectionBuilder current = new SectionBuilder(SectionId.global());

        Iterator<String> lines = LineClassifier.lines(text).iterator();
        while (lines.hasNext()) {
            String line = lines.next();
            log.debug("Parsing line: {}", line);

            ClassifiedLine classified = classifier.classify(line);
            switch (classified.getKind()) {
                case BLANK:
                    break;
                case KEY_VALUE:
                    current.addEntry(new Entry(classified.key(), classified.value()));
                    break;
                case SECTION_HEADER:
                    String name = classified.sectionName();
                    log.debug("Line opens section [{}], adding current section", name);
                    fileBuilder.flush(current.build());
                    current = new SectionBuilder(SectionId.named(name));
                    break;
                case UNPARSABLE:
                default:
                    log.warn("Skipping unparsable non-empty line: {}", line);
                    break;
            }
        }

        log.debug("End of input reached, adding current section");
        return fileBuilder.flush(current.build()).build();
    }
}
