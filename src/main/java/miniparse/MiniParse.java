package miniparse;

import lombok.NonNull;
import miniparse.models.Entry;
import miniparse.models.IniFile;
import miniparse.models.Section;

import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

public class MiniParse implements IniService {

    private static final String LINE_SEPARATOR = "\n";

    private final IniParser parser;
    private final IniFinder finder;

    public MiniParse() {
        this(new LineClassifier());
    }

    public MiniParse(@NonNull LineClassifier classifier) {
        this.parser = new IniParser(classifier);
        this.finder = new IniFinder(classifier);
    }

    @Override
    public IniFile parse(String data) {
        return parser.parse(data);
    }

    @Override
    public Optional<String> find(String data, String key, String section) {
        return finder.find(data, key, section);
    }

    @Override
    public String render(@NonNull IniFile file) {
        StringJoiner result = new StringJoiner(LINE_SEPARATOR);
        file.getGlobalSection().ifPresent(global -> addEntries(result, global));
        for (Map.Entry<String, Section> section : file.getSections().entrySet()) {
            result.add("[" + section.getKey() + "]");
            addEntries(result, section.getValue());
        }
        return result.toString();
    }

    private static void addEntries(StringJoiner result, Section section) {
        for (Entry entry : section.getEntries()) {
            result.add(entry.toString());
        }
    }
}
