package gov.nih.ncats.molrender;

import org.junit.Test;

import java.awt.geom.Rectangle2D;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
public class MolRenderTest {

    private static final String CAFFEINE = "CN1C=NC2=C1C(=O)N(C(=O)N2C)C";

    @Test
    public void blankInputGivesPlaceholder(){
        for(String s : new String[]{null, "", "   ", "\t\n"}){
            String svg = MolRender.render(s);
            assertTrue(svg, svg.startsWith("<svg"));
            assertTrue(svg, svg.contains("No structure"));
        }
    }

    @Test
    public void nullOptionsMeansDefaults(){
        assertEquals(MolRender.render("CCO", new MolRenderOptions()), MolRender.render("CCO", null));
    }

    @Test
    public void onlyBranchesGivesPlaceholderAndDiagnostics(){
        MolRenderResult result = MolRender.renderResult("((((", null);
        assertFalse(result.hasError());
        assertTrue(result.getSvg(), result.getSvg().contains("No structure"));
        assertEquals(4, result.getDiagnostics().size());
        assertFalse(result.getLayoutBounds().isPresent());
    }

    @Test
    public void malformedInputStillRenders(){
        for(String s : new String[]{"C1CC", "CC)C", "C(C", "[Na", "C%1C", "XYZ", "))((", "%%%", "[]"}){
            MolRenderResult result = MolRender.renderResult(s, null);
            assertFalse(s, result.hasError());
            assertTrue(s, result.getSvg().startsWith("<svg"));
            assertTrue(s, result.getSvg().endsWith("</svg>"));
        }
    }

    @Test
    public void unclosedRingIsReported(){
        MolRenderResult result = MolRender.renderResult("C1CC", null);
        List<ParseDiagnostic> diagnostics = result.getDiagnostics();
        assertEquals(1, diagnostics.size());
        assertEquals(ParseDiagnostic.Kind.UNCLOSED_RING, diagnostics.get(0).getKind());
        assertTrue(result.getSvg().contains("<line"));
    }

    @Test
    public void sizeComesFromOptions(){
        String svg = MolRender.render(CAFFEINE, new MolRenderOptions().width(640).height(480));
        assertTrue(svg, svg.contains("width=\"640\" height=\"480\""));
    }

    @Test
    public void sameInputSameOutput(){
        assertEquals(MolRender.render(CAFFEINE), MolRender.render(CAFFEINE));
    }

    @Test
    public void layoutBoundsAreCentered(){
        MolRenderResult result = MolRender.renderResult("CCCCO", null);
        Rectangle2D r = result.getLayoutBounds().get();
        assertEquals(0, r.getCenterX(), 0.0001);
        assertEquals(0, r.getCenterY(), 0.0001);
        assertTrue(r.getWidth() > 0);
        assertFalse(result.getError().isPresent());
    }

    @Test
    public void errorResult(){
        MolRenderResult result = MolRenderResult.createFromError(new IllegalStateException("bad <thing>"), null);
        assertTrue(result.hasError());
        assertEquals("bad <thing>", result.getError().get().getMessage());
        assertTrue(result.getSvg(), result.getSvg().contains("Error: bad &lt;thing&gt;"));
        assertTrue(result.getSvg(), result.getSvg().contains("width=\"400\""));
        assertTrue(result.getDiagnostics().isEmpty());
        assertFalse(result.getLayoutBounds().isPresent());
    }

    @Test
    public void errorWithoutMessageUsesExceptionName(){
        MolRenderResult result = MolRenderResult.createFromError(new NullPointerException(), new MolRenderOptions().width(50));
        assertTrue(result.getSvg(), result.getSvg().contains("Error: NullPointerException"));
        assertTrue(result.getSvg(), result.getSvg().contains("width=\"50\""));
    }

    @Test
    public void asyncMatchesSync() throws Exception{
        MolRenderResult async = MolRender.renderAsync(CAFFEINE).get(10, TimeUnit.SECONDS);
        assertEquals(MolRender.render(CAFFEINE), async.getSvg());
    }

    @Test
    public void asyncOnExecutor() throws Exception{
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            MolRenderOptions options = new MolRenderOptions().showCarbons(true);
            MolRenderResult result = MolRender.renderAsync("c1ccccc1O", options, executor).get(10, TimeUnit.SECONDS);
            assertEquals(MolRender.render("c1ccccc1O", options), result.getSvg());
        }finally {
            executor.shutdownNow();
        }
    }
}
