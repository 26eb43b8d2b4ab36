package com.repocheck.core.library;

import com.repocheck.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Library surface read from the Python sources of a package directory.
 *
 * <p>Every top-level {@code *.py} file of the package is a module. Module contents are
 * extracted with regular expressions rather than a Python parser:
 *
 * <pre>{@code
 * from .modeling_utils import PreTrainedModel          # re-export, owned by modeling_utils
 * from .file_utils import (add_start_docstrings,
 *                          add_code_sample_docstrings as add_samples)
 *
 * class BertPreTrainedModel(PreTrainedModel):          # defined here
 *     ...
 *
 * def load_tf_weights_in_bert(model, config, path):    # non-class member
 *     ...
 * }</pre>
 *
 * <p>Docstrings and comments are dropped before matching, so a class statement quoted in a
 * docstring is not a definition. Only column-zero {@code class}/{@code def} statements
 * count, so nested classes and methods are ignored. Supertypes are resolved transitively through the module's own
 * classes and its relative imports; a base that cannot be resolved (e.g. {@code nn.Module})
 * contributes its simple name only. Names imported by {@code __init__.py} become
 * non-module top-level members.
 *
 * @see LibrarySurface
 * @since 1.0.0
 */
public final class PythonSourceLibrarySurface implements LibrarySurface {

    private static final Logger log = LoggerFactory.getLogger(PythonSourceLibrarySurface.class);

    private static final String PYTHON_EXTENSION = ".py";
    private static final String PACKAGE_INIT = "__init__";

    static final Pattern CLASS_DEF_PATTERN =
        Pattern.compile("^class\\s+(\\w+)\\s*(?:\\(([^)]*)\\))?\\s*:", Pattern.MULTILINE);

    static final Pattern FUNCTION_DEF_PATTERN =
        Pattern.compile("^(?:async\\s+)?def\\s+(\\w+)\\s*\\(", Pattern.MULTILINE);

    static final Pattern ASSIGNMENT_PATTERN =
        Pattern.compile("^([A-Za-z_]\\w*)\\s*(?::[^=\\n]+)?=(?!=)", Pattern.MULTILINE);

    /**
     * Triple-quoted string (group 1), single-line string (group 2) or line comment (group 3),
     * whichever starts first.
     */
    static final Pattern STRING_OR_COMMENT_PATTERN = Pattern.compile(
        "(\"\"\"[\\s\\S]*?\"\"\"|'''[\\s\\S]*?''')"
            + "|(\"(?:\\\\.|[^\"\\\\\\n])*\"|'(?:\\\\.|[^'\\\\\\n])*')"
            + "|(#[^\\n]*)");
    private static final Pattern ALIAS_PATTERN = Pattern.compile("^(\\w+)(?:\\s+as\\s+(\\w+))?$");

    private final String name;
    private final Map<String, SourceModule> sources;
    private final Set<String> topLevelNames;
    private final Map<String, LibraryModule> modules = new TreeMap<>();

    private PythonSourceLibrarySurface(String name, Map<String, SourceModule> sources, Set<String> initExports) {
        this.name = name;
        this.sources = sources;

        Set<String> names = new TreeSet<>(sources.keySet());
        names.addAll(initExports);
        this.topLevelNames = Collections.unmodifiableSet(names);

        for (String identifier : sources.keySet()) {
            modules.put(identifier, buildModule(sources.get(identifier)));
        }
    }

    /**
     * Scans a Python package directory.
     *
     * @param packageDir directory containing the package's {@code __init__.py}
     * @param libraryName importable package name (e.g., "transformers")
     * @return library surface
     * @throws IOException if the directory or one of its modules cannot be read
     */
    public static PythonSourceLibrarySurface load(Path packageDir, String libraryName) throws IOException {
        log.debug("Scanning Python package {} at {}", libraryName, packageDir);
        Pattern importPattern = relativeImportPattern(libraryName);

        Map<String, SourceModule> sources = new LinkedHashMap<>();
        Set<String> initExports = new TreeSet<>();

        for (Path file : FileUtils.listFiles(packageDir, PYTHON_EXTENSION)) {
            String identifier = FileUtils.stem(file);
            String content = stripDocstringsAndComments(FileUtils.readString(file));

            if (PACKAGE_INIT.equals(identifier)) {
                initExports.addAll(parseImports(content, importPattern).keySet());
                continue;
            }
            SourceModule module = parseModule(identifier, content, importPattern);
            sources.put(identifier, module);
            log.debug("Module {}: {} classes, {} imports", identifier,
                module.classBases().size(), module.imports().size());
        }

        log.info("Scanned {} modules of {}", sources.size(), libraryName);
        return new PythonSourceLibrarySurface(libraryName, sources, initExports);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Set<String> topLevelNames() {
        return topLevelNames;
    }

    @Override
    public Optional<LibraryModule> module(String name) {
        return Optional.ofNullable(modules.get(name));
    }

    // ==================== Parsing ====================

    private static Pattern relativeImportPattern(String libraryName) {
        return Pattern.compile(
            "^from\\s+(?:\\.|" + Pattern.quote(libraryName) + "\\.)(\\w+)\\s+import\\s+(\\([^)]*\\)|[^\\n]+)",
            Pattern.MULTILINE);
    }

    /**
     * Blanks out triple-quoted strings and line comments. Single-line string literals are
     * kept, so a {@code #} inside one is not taken for a comment.
     */
    static String stripDocstringsAndComments(String content) {
        return STRING_OR_COMMENT_PATTERN.matcher(content).replaceAll(match ->
            match.group(2) != null ? Matcher.quoteReplacement(match.group()) : "");
    }

    static SourceModule parseModule(String identifier, String content, Pattern importPattern) {
        Map<String, List<String>> classBases = new LinkedHashMap<>();
        Matcher classMatcher = CLASS_DEF_PATTERN.matcher(content);
        while (classMatcher.find()) {
            classBases.put(classMatcher.group(1), parseBases(classMatcher.group(2)));
        }

        Set<String> values = new LinkedHashSet<>();
        Matcher functionMatcher = FUNCTION_DEF_PATTERN.matcher(content);
        while (functionMatcher.find()) {
            values.add(functionMatcher.group(1));
        }
        Matcher assignmentMatcher = ASSIGNMENT_PATTERN.matcher(content);
        while (assignmentMatcher.find()) {
            values.add(assignmentMatcher.group(1));
        }
        values.removeAll(classBases.keySet());

        return new SourceModule(identifier, classBases, values, parseImports(content, importPattern));
    }

    private static List<String> parseBases(String baseList) {
        List<String> bases = new ArrayList<>();
        if (baseList == null) {
            return bases;
        }
        for (String part : baseList.split(",")) {
            String base = part.strip();
            // keyword arguments such as metaclass=ABCMeta are not bases
            if (!base.isEmpty() && !base.contains("=")) {
                bases.add(base);
            }
        }
        return bases;
    }

    private static Map<String, ImportedName> parseImports(String content, Pattern importPattern) {
        Map<String, ImportedName> imports = new LinkedHashMap<>();
        Matcher matcher = importPattern.matcher(content);
        while (matcher.find()) {
            String sourceModule = matcher.group(1);
            String names = matcher.group(2).replace("(", "").replace(")", "").replace("\\", " ");
            for (String part : names.split(",")) {
                Matcher alias = ALIAS_PATTERN.matcher(part.strip().replaceAll("\\s+", " "));
                if (alias.matches()) {
                    String original = alias.group(1);
                    String exposed = alias.group(2) != null ? alias.group(2) : original;
                    imports.put(exposed, new ImportedName(sourceModule, original));
                }
            }
        }
        return imports;
    }

    // ==================== Resolution ====================

    private LibraryModule buildModule(SourceModule source) {
        List<ExportedMember> members = new ArrayList<>();

        for (String className : source.classBases().keySet()) {
            members.add(ExportedMember.classMember(className, source.identifier(),
                ancestorsOf(source.identifier(), className)));
        }
        for (String value : source.values()) {
            members.add(ExportedMember.value(value, source.identifier()));
        }
        for (Map.Entry<String, ImportedName> entry : source.imports().entrySet()) {
            String exposed = entry.getKey();
            ImportedName imported = entry.getValue();
            // a local definition shadows the import
            if (source.classBases().containsKey(exposed) || source.values().contains(exposed)) {
                continue;
            }
            members.add(resolve(imported.sourceModule(), imported.name(), new HashSet<>())
                .map(definition -> definition.isClass()
                    ? ExportedMember.classMember(exposed, definition.module(),
                        ancestorsOf(definition.module(), definition.name()))
                    : ExportedMember.value(exposed, definition.module()))
                .orElseGet(() -> ExportedMember.value(exposed, imported.sourceModule())));
        }

        members.sort((a, b) -> a.name().compareTo(b.name()));
        return new LibraryModule(source.identifier(), members);
    }

    private Set<String> ancestorsOf(String moduleIdentifier, String className) {
        Set<String> ancestors = new LinkedHashSet<>();
        collectAncestors(moduleIdentifier, className, ancestors, new HashSet<>());
        return ancestors;
    }

    private void collectAncestors(String moduleIdentifier, String className, Set<String> ancestors, Set<String> visited) {
        if (!visited.add(moduleIdentifier + "." + className)) {
            return;
        }
        SourceModule module = sources.get(moduleIdentifier);
        if (module == null || !module.classBases().containsKey(className)) {
            return;
        }
        for (String base : module.classBases().get(className)) {
            String simpleName = base.substring(base.lastIndexOf('.') + 1);
            ancestors.add(simpleName);
            resolve(moduleIdentifier, simpleName, new HashSet<>())
                .filter(Definition::isClass)
                .ifPresent(definition -> {
                    ancestors.add(definition.name());
                    collectAncestors(definition.module(), definition.name(), ancestors, visited);
                });
        }
    }

    /**
     * Follows a name through a module's definitions and import chain to where it is defined.
     */
    private Optional<Definition> resolve(String moduleIdentifier, String memberName, Set<String> visited) {
        if (!visited.add(moduleIdentifier + "." + memberName)) {
            return Optional.empty();
        }
        SourceModule module = sources.get(moduleIdentifier);
        if (module == null) {
            return Optional.empty();
        }
        if (module.classBases().containsKey(memberName)) {
            return Optional.of(new Definition(moduleIdentifier, memberName, true));
        }
        if (module.values().contains(memberName)) {
            return Optional.of(new Definition(moduleIdentifier, memberName, false));
        }
        ImportedName imported = module.imports().get(memberName);
        if (imported == null) {
            return Optional.empty();
        }
        return resolve(imported.sourceModule(), imported.name(), visited);
    }

    record SourceModule(
        String identifier,
        Map<String, List<String>> classBases,
        Set<String> values,
        Map<String, ImportedName> imports
    ) {}

    record ImportedName(String sourceModule, String name) {}

    record Definition(String module, String name, boolean isClass) {}
}
