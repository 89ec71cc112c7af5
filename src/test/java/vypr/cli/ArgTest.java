package vypr.cli;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArgTest {

    @Test
    void sourceOnly() {
        Arg arg = Arg.parse(new String[]{"hello.vy"});
        assertEquals("hello.vy", arg.srcFilename);
        assertFalse(arg.hasOutputFile());
        assertFalse(arg.compileOnly);
        assertFalse(arg.interpret);
        assertEquals("python3", arg.python);
    }

    @Test
    void allFlags() {
        Arg arg = Arg.parse(new String[]{"-S", "-o", "out.py", "-ir", "-keep", "-python", "/usr/bin/python3.12", "a.vy"});
        assertEquals("a.vy", arg.srcFilename);
        assertEquals("out.py", arg.outputFilename);
        assertTrue(arg.hasOutputFile());
        assertTrue(arg.compileOnly);
        assertTrue(arg.dumpIr);
        assertTrue(arg.keep);
        assertEquals("/usr/bin/python3.12", arg.python);
    }

    @Test
    void interpretFlag() {
        assertTrue(Arg.parse(new String[]{"a.vy", "-interpret"}).interpret);
    }

    @Test
    void invalidCommandLines() {
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{}));
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{"a.vy", "b.vy"}));
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{"a.vy", "-o"}));
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{"a.vy", "-x"}));
        assertThrows(IllegalArgumentException.class, () -> Arg.parse(new String[]{"a.vy", "-S", "-interpret"}));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Arg.parse(new String[]{"a.vy", "--verbose"}));
        assertTrue(e.getMessage().contains(Arg.USAGE));
    }
}
