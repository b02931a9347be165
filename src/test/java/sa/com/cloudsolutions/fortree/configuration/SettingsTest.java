package sa.com.cloudsolutions.fortree.configuration;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SettingsTest {

    @Test
    void loadTestConfiguration() throws IOException {
        Settings.loadConfigMap(new File("src/test/resources/fortree-test.yml"));

        assertEquals(List.of("src/test/resources/fortran/lib", "src/test/resources/fortran/app"), Settings.getTree());
        assertEquals("src/test/resources/fortran/missing/tree.json", Settings.getDescTreeFile());
        assertEquals(List.of("", ".json", ".txt"), Settings.getExcludedExtensions());
        assertEquals("/usr/bin/dot", Settings.getDotCommand());
        assertEquals("/usr/bin/dot", Settings.getProperty("graphviz.dot", String.class).orElseThrow());
        assertTrue(Settings.getProperty("no.such.key", String.class).isEmpty());
    }

    @Test
    void defaults() throws IOException {
        Settings.loadConfigMap(new File("src/test/resources/fortree-defaults.yml"));

        assertEquals(List.of("src/test/resources/fortran/lib"), Settings.getTree());
        assertNull(Settings.getDescTreeFile());
        assertEquals(List.of("", ".json", ".fypp", ".txt"), Settings.getExcludedExtensions());
        assertEquals("dot", Settings.getDotCommand());
    }

    @Test
    void classPathConfiguration() throws IOException {
        Settings.props = null;
        Settings.loadConfigMap();

        assertEquals("dot", Settings.getDotCommand());
        assertEquals(4, Settings.getExcludedExtensions().size());
        assertFalse(Settings.getTree().isEmpty());
    }
}
