package work.lcod.docpath.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.docpath.api.Document;
import work.lcod.docpath.api.DocumentCodec;
import work.lcod.docpath.clean.FieldCleaner;
import work.lcod.docpath.clean.FieldCleanerLoader;
import work.lcod.docpath.path.Path;
import work.lcod.docpath.walk.WalkArgs;

@CommandLine.Command(
    name = "docpath",
    description = "Read, search, modify and fingerprint JSON / YAML documents by path.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    exitCodeOnExecutionException = DocPathCommand.EXIT_FAILURE,
    subcommands = {
        DocPathCommand.GetCommand.class,
        DocPathCommand.HasCommand.class,
        DocPathCommand.SetCommand.class,
        DocPathCommand.DeleteCommand.class,
        DocPathCommand.FindCommand.class,
        DocPathCommand.PatchCommand.class,
        DocPathCommand.HashCommand.class,
        DocPathCommand.CleanCommand.class
    }
)
final class DocPathCommand implements Callable<Integer> {
    static final int EXIT_ABSENT = 1;
    static final int EXIT_FAILURE = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand.");
    }

    /**
     * Options shared by every subcommand: where the document comes from and how results are
     * rendered.
     */
    abstract static class DocumentCommand implements Callable<Integer> {
        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Option(
            names = {"-f", "--file"},
            paramLabel = "PATH|-",
            description = "Document to read; '-' or no value reads stdin.",
            defaultValue = CommandLine.Option.NULL_VALUE
        )
        java.nio.file.Path file;

        @CommandLine.Option(
            names = "--format",
            description = "Input format (auto|json|yaml).",
            defaultValue = "auto"
        )
        String format;

        @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Output format (json|yaml).",
            defaultValue = "json"
        )
        String output;

        @CommandLine.Option(
            names = "--log-level",
            description = "Log threshold (trace|debug|info|warn|error|off).",
            defaultValue = CommandLine.Option.NULL_VALUE
        )
        String logLevelRaw;

        @Override
        public final Integer call() throws Exception {
            if (logLevelRaw != null) {
                LogLevel.from(logLevelRaw).applyToRoot();
            }
            return run(readDocument());
        }

        abstract int run(Document document) throws Exception;

        Document readDocument() {
            var text = readInput();
            return Document.of(DocumentCodec.readDocument(text, DocumentCodec.Format.from(format)));
        }

        void print(Object value) {
            PrintWriter out = spec.commandLine().getOut();
            if (DocumentCodec.Format.from(output) == DocumentCodec.Format.YAML) {
                out.print(DocumentCodec.toYaml(value));
            } else {
                out.println(DocumentCodec.toPrettyJson(value));
            }
            out.flush();
        }

        Path parsePath(String text) {
            return Path.parse(text);
        }

        Object parseValue(String text) {
            if (text.isBlank()) {
                // blank YAML reads as null, which would delete the key
                return text;
            }
            // YAML also reads JSON and plain scalars
            return DocumentCodec.readValue(text, DocumentCodec.Format.YAML);
        }

        private String readInput() {
            if (file == null || "-".equals(file.toString())) {
                return readStream(System.in);
            }
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Cannot read input file: " + file);
            }
        }

        private String readStream(InputStream in) {
            try {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new CommandLine.ExecutionException(spec.commandLine(), "Unable to read stdin", ex);
            }
        }
    }

    @CommandLine.Command(name = "get", description = "Print the value at a path.")
    static final class GetCommand extends DocumentCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "PATH", description = "JQ-like path or JSON pointer.")
        String path;

        @CommandLine.Option(names = "--all", description = "Collect every match of '[]' segments.")
        boolean all;

        @Override
        int run(Document document) {
            var args = WalkArgs.builder().matchAll(all).build();
            print(document.walk(parsePath(path), args));
            return 0;
        }
    }

    @CommandLine.Command(name = "has", description = "Print whether a path resolves; exits with 1 when it does not.")
    static final class HasCommand extends DocumentCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "PATH")
        String path;

        @Override
        int run(Document document) {
            boolean present = document.has(parsePath(path));
            print(present);
            return present ? 0 : EXIT_ABSENT;
        }
    }

    @CommandLine.Command(name = "set", description = "Write a value, creating missing parents, and print the document.")
    static final class SetCommand extends DocumentCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "PATH")
        String path;

        @CommandLine.Parameters(index = "1", paramLabel = "VALUE", description = "JSON or YAML value.")
        String value;

        @Override
        int run(Document document) {
            document.set(parsePath(path), parseValue(value));
            print(document.asMap());
            return 0;
        }
    }

    @CommandLine.Command(name = "delete", description = "Remove the value at a path and print the document.")
    static final class DeleteCommand extends DocumentCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "PATH")
        String path;

        @Override
        int run(Document document) {
            document.delete(parsePath(path));
            print(document.asMap());
            return 0;
        }
    }

    @CommandLine.Command(name = "find", description = "Print the JSON pointers of matching values.")
    static final class FindCommand extends DocumentCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "PATH")
        String path;

        @CommandLine.Option(names = "--value", description = "Only report values equal to this JSON or YAML value.")
        String value;

        @CommandLine.Option(names = "--first", description = "Stop at the first match.")
        boolean first;

        @Override
        int run(Document document) {
            Object expected = value == null ? null : parseValue(value);
            List<Path> matches = first
                ? document.findFirst(parsePath(path), expected).map(List::of).orElse(List.of())
                : document.findAll(parsePath(path), expected);
            var pointers = new ArrayList<String>(matches.size());
            for (Path match : matches) {
                pointers.add(match.toJsonPointer());
            }
            print(pointers);
            return matches.isEmpty() ? EXIT_ABSENT : 0;
        }
    }

    @CommandLine.Command(name = "patch", description = "Print the JSON patch 'add' operation that writes a value.")
    static final class PatchCommand extends DocumentCommand {
        @CommandLine.Parameters(index = "0", paramLabel = "PATH")
        String path;

        @CommandLine.Parameters(index = "1", paramLabel = "VALUE", description = "JSON or YAML value.")
        String value;

        @Override
        int run(Document document) {
            var patch = document.generatePatch(parsePath(path), parseValue(value));
            print(List.of(patch.toAddOperation()));
            return 0;
        }
    }

    @CommandLine.Command(name = "hash", description = "Print the order-independent hash of the document.")
    static final class HashCommand extends DocumentCommand {
        @Override
        int run(Document document) {
            var result = new LinkedHashMap<String, Object>();
            result.put("hash", Long.toUnsignedString(document.hash(), 16));
            result.put("base64", document.hashString());
            print(result);
            return 0;
        }
    }

    @CommandLine.Command(name = "clean", description = "Strip server-managed fields and print the document.")
    static final class CleanCommand extends DocumentCommand {
        @CommandLine.Option(
            names = "--cleaner",
            paramLabel = "TOML",
            description = "Field cleaner descriptor (default: Kubernetes managed fields).",
            defaultValue = CommandLine.Option.NULL_VALUE
        )
        java.nio.file.Path cleaner;

        @Override
        int run(Document document) {
            FieldCleaner fieldCleaner = cleaner == null
                ? FieldCleaner.kubernetesManagedFields()
                : FieldCleanerLoader.load(cleaner);
            document.removeFields(fieldCleaner);
            print(document.asMap());
            return 0;
        }
    }
}
