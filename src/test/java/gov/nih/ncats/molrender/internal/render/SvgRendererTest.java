package gov.nih.ncats.molrender.internal.render;

import static org.junit.Assert.*;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.junit.Test;

import gov.nih.ncats.molrender.MolRenderOptions;
import gov.nih.ncats.molrender.internal.algo.CoordinateGenerator;
import gov.nih.ncats.molrender.internal.algo.SmilesParser;
import gov.nih.ncats.molrender.internal.util.ConnectionTable;

public class SvgRendererTest {

    private static String render(String smiles){
        return render(smiles, new MolRenderOptions());
    }

    private static String render(String smiles, MolRenderOptions options){
        ConnectionTable ct = new CoordinateGenerator(new SmilesParser(smiles).getCtab()).layout();
        return new SvgRenderer(options).render(ct);
    }

    private static int count(String svg, String what){
        int count=0;
        int i = svg.indexOf(what);
        while(i>=0){
            count++;
            i = svg.indexOf(what, i+what.length());
        }
        return count;
    }

    @Test
    public void documentHasRequestedSize(){
        String svg = render("CCO", new MolRenderOptions().width(300).height(200));
        assertTrue(svg, svg.startsWith("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"300\" height=\"200\""));
        assertTrue(svg, svg.contains("viewBox=\"0 0 300 200\""));
        assertTrue(svg, svg.endsWith("</svg>"));
        assertEquals(1, count(svg, "<g transform=\"translate("));
    }

    @Test
    public void ethanolOxygenIsLabeledWithHydrogen(){
        String svg = render("CCO");
        assertTrue(svg, svg.contains(">OH</text>"));
        //carbons stay unlabeled
        assertEquals(1, count(svg, "<text"));
        assertEquals(2, count(svg, "<line"));
    }

    @Test
    public void doubleBondDrawsTwoLines(){
        String svg = render("C=O");
        assertEquals(2, count(svg, "<line"));
        assertTrue(svg, svg.contains(">O</text>"));
    }

    @Test
    public void carbonylInAceticAcid(){
        assertEquals(4, count(render("CC(=O)O"), "<line"));
    }

    @Test
    public void tripleBondDrawsThreeLines(){
        assertEquals(3, count(render("C#C"), "<line"));
    }

    @Test
    public void wedgeBondIsPolygon(){
        String svg = render("C/C");
        assertEquals(1, count(svg, "<polygon"));
        assertEquals(0, count(svg, "<line"));
    }

    @Test
    public void hashedBondIsDashed(){
        String svg = render("C\\C");
        assertTrue(svg, svg.contains("stroke-dasharray=\"4,4\""));
    }

    @Test
    public void aromaticBondsAreDashed(){
        String svg = render("c1ccccc1");
        assertEquals(6, count(svg, "stroke-dasharray=\"3,2\""));
        assertEquals(0, count(svg, "<text"));
    }

    @Test
    public void caffeine(){
        String svg = render("CN1C=NC2=C1C(=O)N(C(=O)N2C)C");
        //4 nitrogens and 2 oxygens
        assertEquals(6, count(svg, "<text"));
        //11 single and 4 double bonds
        assertEquals(19, count(svg, "<line"));
    }

    @Test
    public void showCarbonsLabelsEveryCarbon(){
        String svg = render("CC", new MolRenderOptions().showCarbons(true));
        assertEquals(2, count(svg, ">C</text>"));

        String withH = render("CC", new MolRenderOptions().showCarbons(true).showImplicitHydrogens(true));
        assertEquals(2, count(withH, ">CH3</text>"));
    }

    @Test
    public void chargedAtomsGetSuperscript(){
        String svg = render("[NH4+]");
        assertTrue(svg, svg.contains(">NH4</text>"));
        assertTrue(svg, svg.contains(">+</text>"));

        String carbanion = render("[CH3-]");
        assertTrue(carbanion, carbanion.contains(">C</text>"));
        assertTrue(carbanion, carbanion.contains(">-</text>"));

        assertTrue(render("[O-2]").contains(">2-</text>"));
    }

    @Test
    public void isotopePrefix(){
        String svg = render("[18OH2]");
        assertTrue(svg, svg.contains(">18OH2</text>"));
    }

    @Test
    public void chargeText(){
        assertNull(SvgRenderer.chargeText(0));
        assertEquals("+", SvgRenderer.chargeText(1));
        assertEquals("2+", SvgRenderer.chargeText(2));
        assertEquals("-", SvgRenderer.chargeText(-1));
        assertEquals("3-", SvgRenderer.chargeText(-3));
    }

    @Test
    public void emptyTableGivesPlaceholder(){
        String svg = new SvgRenderer(new MolRenderOptions()).render(new ConnectionTable());
        assertTrue(svg, svg.contains(">No structure</text>"));
        assertTrue(svg, svg.contains("width=\"400\" height=\"400\""));
    }

    @Test
    public void errorMessageIsEscaped(){
        String svg = new SvgRenderer(new MolRenderOptions()).error("a<b & \"c\"");
        assertTrue(svg, svg.contains(">Error: a&lt;b &amp; &quot;c&quot;</text>"));
        assertTrue(svg, svg.contains("fill=\"red\""));
    }

    @Test(expected = IllegalStateException.class)
    public void structureMustBeLaidOut(){
        new SvgRenderer(new MolRenderOptions()).render(new SmilesParser("CC").getCtab());
    }

    @Test
    public void numberFormat(){
        assertEquals("0", SvgRenderer.fmt(-0.001));
        assertEquals("0", SvgRenderer.fmt(0));
        assertEquals("3", SvgRenderer.fmt(3.0));
        assertEquals("12.35", SvgRenderer.fmt(12.3456));
        assertEquals("-7.5", SvgRenderer.fmt(-7.5));
        assertEquals("1234567.25", SvgRenderer.fmt(1234567.25));
    }

    @Test
    public void outputDoesNotDependOnDefaultLocale(){
        Locale old = Locale.getDefault();
        String english;
        String german;
        try{
            Locale.setDefault(Locale.ENGLISH);
            english = render("CC(=O)O");
            Locale.setDefault(Locale.GERMANY);
            german = render("CC(=O)O");
        }finally{
            Locale.setDefault(old);
        }
        assertEquals(english, german);

        Matcher m = Pattern.compile("x1=\"([^\"]*)\"").matcher(german);
        assertTrue(m.find());
        assertTrue(m.group(1), m.group(1).matches("-?\\d+(\\.\\d{1,2})?"));
    }

    @Test
    public void renderingIsRepeatable(){
        assertEquals(render("CN1C=NC2=C1C(=O)N(C(=O)N2C)C"), render("CN1C=NC2=C1C(=O)N(C(=O)N2C)C"));
    }
}
