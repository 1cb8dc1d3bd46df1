package gov.nih.ncats.molrender;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

import gov.nih.ncats.molrender.internal.algo.CoordinateGenerator;
import gov.nih.ncats.molrender.internal.algo.SmilesParser;
import gov.nih.ncats.molrender.internal.util.ConnectionTable;

/**
 * Turns a SMILES notation into an SVG diagram.
 * <pre>
 * String svg = MolRender.render("CC(=O)O");
 * </pre>
 * Every call works on its own parser, graph and renderer, so the methods
 * here can be called from any number of threads at once.
 */
public final class MolRender {
	private static final Logger logger = Logger.getLogger(MolRender.class.getName());

	private static final boolean DEBUG;

	static {
		boolean debug = false;
		try {
			debug = Boolean.getBoolean("molrender.debug");
		} catch (SecurityException ex) {
			logger.log(Level.FINE, "can not read molrender.debug", ex);
		}
		DEBUG = debug;
	}

	private static MolRenderOptions DEFAULT_OPTIONS = new MolRenderOptions();

	private MolRender(){
	}

	/**
	 * Render the given notation with the default options.
	 * @param notation the SMILES string; null or blank gives the "No structure" placeholder.
	 * @return a complete SVG document; never null.
	 */
	public static String render(String notation){
		return render(notation, DEFAULT_OPTIONS);
	}

	/**
	 * Render the given notation.
	 * @param notation the SMILES string; null or blank gives the "No structure" placeholder.
	 * @param options the {@link MolRenderOptions} to use; if options is null, then the default options are used.
	 * @return a complete SVG document; never null. Anything that goes wrong is
	 * drawn as an error message instead of being thrown.
	 */
	public static String render(String notation, MolRenderOptions options){
		return renderResult(notation, options).getSvg();
	}

	/**
	 * Render the given notation and keep the parse diagnostics, layout bounds
	 * and any error alongside the document.
	 * @param notation the SMILES string; null or blank gives the "No structure" placeholder.
	 * @param options the {@link MolRenderOptions} to use; if options is null, then the default options are used.
	 * @return a {@link MolRenderResult}; never null.
	 */
	public static MolRenderResult renderResult(String notation, MolRenderOptions options){
		MolRenderOptions opts = Optional.ofNullable(options).orElse(DEFAULT_OPTIONS);
		try{
			if(notation==null || notation.trim().isEmpty()){
				return opts.computeResult(new ConnectionTable(), null);
			}
			long start = System.nanoTime();
			SmilesParser parser = new SmilesParser(notation);
			ConnectionTable ct = parser.getCtab();
			List<ParseDiagnostic> diagnostics = parser.getDiagnostics();
			long parsed = System.nanoTime();

			new CoordinateGenerator(ct).layout();
			long laidOut = System.nanoTime();

			MolRenderResult result = opts.computeResult(ct, diagnostics);
			if(DEBUG){
				logger.fine(String.format("%s: parse %d us, layout %d us, render %d us",
						notation,
						(parsed-start)/1000,
						(laidOut-parsed)/1000,
						(System.nanoTime()-laidOut)/1000));
			}
			return result;
		}catch(Throwable t){
			logger.log(Level.WARNING, "could not render '" + notation + "'", t);
			return MolRenderResult.createFromError(t, opts);
		}
	}

	public static CompletableFuture<MolRenderResult> renderAsync(String notation){
		return renderAsync(notation, DEFAULT_OPTIONS);
	}

	public static CompletableFuture<MolRenderResult> renderAsync(String notation, MolRenderOptions options){
		return CompletableFuture.supplyAsync(() -> renderResult(notation, options));
	}

	public static CompletableFuture<MolRenderResult> renderAsync(String notation, MolRenderOptions options, Executor executor){
		return CompletableFuture.supplyAsync(() -> renderResult(notation, options), executor);
	}
}
