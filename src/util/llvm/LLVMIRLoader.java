package util.llvm;

import ir.IRModule;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads textual LLVM IR (.ll) into an {@link IRModule}.
 */
public class LLVMIRLoader {
    private static final String TEST_RESOURCE_DIR = "expected/ir/";

    public static IRModule loadFromFile(String filePath) throws IOException, LLVMParseException {
        return loadFromFile(filePath, LoaderConfig.defaultConfig());
    }

    public static IRModule loadFromFile(String filePath, LoaderConfig config) throws IOException, LLVMParseException {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + filePath);
        }
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        return parseLines(lines, extractModuleName(path.getFileName().toString()), config);
    }

    /**
     * @param resourcePath classpath resource, e.g. "expected/ir/single_loop.ll"
     */
    public static IRModule loadFromResource(String resourcePath) throws IOException, LLVMParseException {
        return loadFromResource(resourcePath, LoaderConfig.defaultConfig());
    }

    public static IRModule loadFromResource(String resourcePath, LoaderConfig config) throws IOException, LLVMParseException {
        try (InputStream inputStream = LLVMIRLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                List<String> lines = reader.lines().collect(Collectors.toList());
                return parseLines(lines, extractModuleName(resourcePath), config);
            }
        }
    }

    /** loads {@code expected/ir/<testFileName>} from the test classpath */
    public static IRModule loadFromTestResource(String testFileName) throws IOException, LLVMParseException {
        return loadFromResource(TEST_RESOURCE_DIR + testFileName);
    }

    public static IRModule parseFromString(String content, String moduleName) throws LLVMParseException {
        return parseFromString(content, moduleName, LoaderConfig.defaultConfig());
    }

    public static IRModule parseFromString(String content, String moduleName, LoaderConfig config) throws LLVMParseException {
        return parseLines(List.of(content.split("\\r?\\n")), moduleName, config);
    }

    private static IRModule parseLines(List<String> lines, String moduleName, LoaderConfig config) throws LLVMParseException {
        return new LLVMIRParser(config).parse(lines, moduleName);
    }

    private static String extractModuleName(String fileName) {
        String name = fileName.substring(fileName.lastIndexOf('/') + 1);
        return name.endsWith(".ll") ? name.substring(0, name.length() - 3) : name;
    }
}
