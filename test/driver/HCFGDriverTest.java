package driver;

import exception.CompileException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static org.junit.jupiter.api.Assertions.*;

class HCFGDriverTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void resetConfig() {
        Config.getInstance().reload();
    }

    private Path copyFixture(String name) throws Exception {
        Path target = tempDir.resolve(name);
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("expected/ir/" + name)) {
            assertNotNull(in, name);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    @Test
    void rejectsBadArguments() {
        HCFGDriver driver = HCFGDriver.getInstance();
        assertThrows(CompileException.class, () -> driver.parseArgs(new String[0]));
        assertThrows(CompileException.class, () -> driver.parseArgs(new String[]{"input.c"}));
        assertThrows(CompileException.class, () -> driver.parseArgs(new String[]{"input.ll", "-o"}));
    }

    @Test
    void noVerifyTurnsTheVerifierOff() {
        HCFGDriver.getInstance().parseArgs(new String[]{"input.ll", "--no-verify"});
        assertFalse(Config.getInstance().isVerifyVPlan());
        assertEquals("input.ll", HCFGDriver.getInstance().getSource());
    }

    @Test
    void writesEveryPlanToTheOutputFile() throws Exception {
        Path input = copyFixture("siblings.ll");
        Path output = tempDir.resolve("plans.txt");

        HCFGDriver driver = HCFGDriver.getInstance();
        driver.parseArgs(new String[]{input.toString(), "-o", output.toString()});
        driver.run();

        String text = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(text.startsWith("VPlan 'siblings.outer' {"), text);
        assertTrue(text.contains("<loop> l1: {"), text);
        assertTrue(text.contains("<loop> l2: {"), text);
        assertTrue(text.contains("Successor(s): vector.body"), text);
    }
}
