package miniparse;

import miniparse.models.IniFile;

import java.util.Optional;

public interface IniService {
    IniFile parse(String data);

    Optional<String> find(String data, String key, String section);

    String render(IniFile file);
}
