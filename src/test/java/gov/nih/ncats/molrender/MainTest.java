package gov.nih.ncats.molrender;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class MainTest {

    @Rule
    public TemporaryFolder tmpDir = new TemporaryFolder();

    @Test
    public void blankLineIsSkipped(){
        assertFalse(Main.parseLine(1, "   ").isPresent());
    }

    @Test
    public void lineWithName(){
        Main.SmilesRecord r = Main.parseLine(4, "  CCO   ethyl alcohol ").get();
        assertEquals("CCO", r.getSmiles());
        assertEquals("ethyl alcohol", r.getName().get());
        assertEquals(4, r.getLineNumber());
        assertEquals("ethyl_alcohol.svg", r.getOutputFileName());
    }

    @Test
    public void lineWithoutNameUsesLineNumber(){
        Main.SmilesRecord r = Main.parseLine(7, "c1ccccc1").get();
        assertFalse(r.getName().isPresent());
        assertEquals("7.svg", r.getOutputFileName());
    }

    @Test
    public void readRecordsCountsBlankLines() throws Exception{
        File in = tmpDir.newFile("list.smi");
        Files.write(in.toPath(), Arrays.asList("CCO ethanol", "", "c1ccccc1"), StandardCharsets.UTF_8);

        List<Main.SmilesRecord> records = Main.readRecords(in);
        assertEquals(2, records.size());
        assertEquals(1, records.get(0).getLineNumber());
        assertEquals(3, records.get(1).getLineNumber());
    }

    @Test
    public void singleSmilesToFile() throws Exception{
        File out = new File(tmpDir.getRoot(), "sub/ethanol.svg");
        Main.main(new String[]{"-s", "CCO", "-o", out.getAbsolutePath(), "-width", "250"});

        String svg = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);
        assertTrue(svg, svg.contains(">OH</text>"));
        assertTrue(svg, svg.contains("width=\"250\""));
    }

    @Test
    public void fileOfSmilesToDirectory() throws Exception{
        File in = tmpDir.newFile("list.smi");
        Files.write(in.toPath(), Arrays.asList("CCO ethanol", "", "c1ccccc1"), StandardCharsets.UTF_8);
        File outDir = new File(tmpDir.getRoot(), "out");

        Main.main(new String[]{"-f", in.getAbsolutePath(), "-outDir", outDir.getAbsolutePath(), "-parallel", "2"});

        assertTrue(new File(outDir, "ethanol.svg").exists());
        assertTrue(new File(outDir, "3.svg").exists());
        String benzene = new String(Files.readAllBytes(new File(outDir, "3.svg").toPath()), StandardCharsets.UTF_8);
        assertTrue(benzene, benzene.contains("stroke-dasharray=\"3,2\""));
    }
}
