package orchestrator.prepare;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Section names of a yum (INI style) repository config.
 */
public final class YumRepoConfig {

    private static final Pattern SECTION = Pattern.compile("^\\s*\\[([^\\]]+)]\\s*$");

    private final List<String> sections;

    private YumRepoConfig(List<String> sections) {
        this.sections = List.copyOf(sections);
    }

    public static YumRepoConfig read(Path file) throws IOException {
        List<String> sections = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            Matcher m = SECTION.matcher(line);
            if (m.matches()) {
                String name = m.group(1).trim();
                if (!name.equalsIgnoreCase("main") && !sections.contains(name)) {
                    sections.add(name);
                }
            }
        }
        return new YumRepoConfig(sections);
    }

    /** Repository sections in file order; {@code [main]} is not a repository. */
    public List<String> sections() {
        return sections;
    }

    /**
     * Sections whose last {@code -}-separated token names one of the distributions,
     * e.g. {@code ovirt-master-el7} for {@code el7}.
     */
    public List<String> sectionsFor(Collection<String> dists) {
        return sections.stream()
                .filter(name -> dists.contains(distOf(name)))
                .toList();
    }

    static String distOf(String section) {
        int dash = section.lastIndexOf('-');
        return dash < 0 ? section : section.substring(dash + 1);
    }
}
