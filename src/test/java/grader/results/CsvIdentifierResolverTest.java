package grader.results;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class CsvIdentifierResolverTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private File csv(String contents) throws IOException {
        File f = tmp.newFile("ids.csv");
        FileUtils.writeStringToFile(f, contents, StandardCharsets.UTF_8);
        return f;
    }

    @Test
    public void load() throws IOException {
        CsvIdentifierResolver r = CsvIdentifierResolver.load(csv("file,identifier\ns1.py, alice\ns2.py,bob\n").toPath());
        assertEquals(2, r.size());
        assertEquals("alice", r.fileToId("s1.py"));
        assertEquals("bob", r.fileToId("s2.py"));
    }

    @Test
    public void columnOrderDoesNotMatter() throws IOException {
        CsvIdentifierResolver r = CsvIdentifierResolver.load(csv("identifier,file\nalice,s1.py\n").toPath());
        assertEquals("alice", r.fileToId("s1.py"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unmapped() throws IOException {
        CsvIdentifierResolver.load(csv("file,identifier\ns1.py,alice\n").toPath()).fileToId("s9.py");
    }

    @Test(expected = IOException.class)
    public void duplicateFile() throws IOException {
        CsvIdentifierResolver.load(csv("file,identifier\ns1.py,alice\ns1.py,bob\n").toPath());
    }

    @Test(expected = IOException.class)
    public void missingColumn() throws IOException {
        CsvIdentifierResolver.load(csv("file,name\ns1.py,alice\n").toPath());
    }
}
