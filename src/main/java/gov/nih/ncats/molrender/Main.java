package gov.nih.ncats.molrender;

import gov.nih.ncats.common.cli.Cli;
import gov.nih.ncats.common.cli.CliSpecification;
import gov.nih.ncats.common.cli.CliValidationException;
import gov.nih.ncats.common.functions.ThrowableConsumer;
import gov.nih.ncats.common.stream.StreamUtil;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static gov.nih.ncats.common.cli.CliSpecification.*;

/**
 * Command line entry point: renders a single SMILES string or a file with
 * one SMILES per line into SVG files.
 */
public class Main {

    private static class RenderSettings{
        private int numThreads =1;

        private File inputFile, outputDir;

        private final MolRenderOptions options = new MolRenderOptions();

        public int getNumThreads() {
            return numThreads;
        }

        public void setNumThreads(int numThreads) throws IOException{
            if(numThreads < 1){
                throw new CliValidationException("num of threads must be >=1");
            }
            this.numThreads = numThreads;
        }

        public File getInputFile() {
            return inputFile;
        }

        public void setInputFile(File inputFile) throws IOException{
            if(!inputFile.exists()){
                throw new FileNotFoundException("file '" + inputFile.getAbsolutePath() + "' does not exist");
            }
            this.inputFile = inputFile;
        }

        public File getOutputDir() {
            return outputDir;
        }

        public void setOutputDir(File outputDir) throws IOException {
            if(outputDir !=null){
                Files.createDirectories(outputDir.toPath());
            }
            this.outputDir = outputDir;
        }

        public MolRenderOptions getOptions() {
            return options;
        }

        public void setWidth(int width) throws IOException{
            try{
                options.width(width);
            }catch(IllegalArgumentException e){
                throw new CliValidationException(e.getMessage());
            }
        }

        public void setHeight(int height) throws IOException{
            try{
                options.height(height);
            }catch(IllegalArgumentException e){
                throw new CliValidationException(e.getMessage());
            }
        }
    }

    /**
     * One non blank line of an input file: the SMILES and an optional name
     * separated from it by whitespace.
     */
    static class SmilesRecord{
        private final int lineNumber;
        private final String smiles;
        private final String name;

        SmilesRecord(int lineNumber, String smiles, String name) {
            this.lineNumber = lineNumber;
            this.smiles = smiles;
            this.name = name;
        }

        public int getLineNumber() {
            return lineNumber;
        }

        public String getSmiles() {
            return smiles;
        }

        public Optional<String> getName() {
            return Optional.ofNullable(name);
        }

        /**
         * File name to write this record's diagram to.
         */
        public String getOutputFileName(){
            String base = getName()
                            .map(n-> n.replaceAll("[^A-Za-z0-9._-]", "_"))
                            .orElse(Integer.toString(lineNumber));
            return base + ".svg";
        }
    }

    static Optional<SmilesRecord> parseLine(int lineNumber, String line){
        String trimmed = line.trim();
        if(trimmed.isEmpty()){
            return Optional.empty();
        }
        String[] parts = trimmed.split("\\s+", 2);
        return Optional.of(new SmilesRecord(lineNumber, parts[0], parts.length>1? parts[1].trim() : null));
    }

    static List<SmilesRecord> readRecords(File f) throws IOException{
        String content = new String(Files.readAllBytes(f.toPath()), StandardCharsets.UTF_8);
        AtomicInteger lineNumber = new AtomicInteger();
        return StreamUtil.lines(content)
                .map(line -> parseLine(lineNumber.incrementAndGet(), line))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .collect(Collectors.toList());
    }

    public static void main(String[] args) throws Exception{

        RenderSettings settings = new RenderSettings();

        CliSpecification spec = CliSpecification.createWithHelp(
                radio(
                group(option("s").longName("smiles")
                        .argName("smiles")
                        .description("SMILES string of the structure to draw. This option or -f is required")
                        .setRequired(true),
                        option("o").longName("out")
                                .argName("path")
                                .description("path of output svg. If not specified output is sent to STDOUT")

                        ),
                        group(
                        option("f").longName("file")
                                .argName("path")
                                .description("path to a text file with one SMILES per line, optionally followed by whitespace and a name. " +
                                        "Each line is drawn to its own svg file named $name.svg, or $lineNumber.svg if the line has no name. " +
                                        "This option or -s is required")
                                .setToFile(settings::setInputFile)
                                .setRequired(true),
                            option("outDir")
                                    .argName("path")
                                    .setToFile(settings::setOutputDir)
                                    .description("path to output directory to put svg files. If this path does not exist it will be created. " +
                                            "If not specified the files are written next to the input file"),
                                option("parallel")
                                        .argName("count")
                                        .setToInt(settings::setNumThreads)
                                        .description("Number of lines to render simultaneously, if not specified defaults to 1")

                        )),
                option("width")
                        .argName("pixels")
                        .setToInt(settings::setWidth)
                        .description("width of the svg, defaults to 400"),
                option("height")
                        .argName("pixels")
                        .setToInt(settings::setHeight)
                        .description("height of the svg, defaults to 400"),
                option("showCarbons").isFlag(true)
                        .description("label every carbon atom"),
                option("showHydrogens").isFlag(true)
                        .description("add implicit hydrogen counts to labeled carbon atoms")
                )
        .programName("molrender")
        .description("SMILES to SVG renderer. Parses the given SMILES, computes a 2D layout and draws it as a skeletal formula.")
        .addValidation(cli->cli.hasOption("s") || cli.hasOption("f"),
                "-s or -f option is required")

        .example("-s CCO", "draw ethanol and print the svg to STDOUT")
        .example("-s \"c1ccccc1O\" -o phenol.svg -width 300 -height 300", "draw phenol into a 300x300 svg file")
        .example("-f /path/to/list.smi", "draw every line of the given file and write $name.svg files next to it")
        .example("-f /path/to/list.smi -outDir /path/to/outputDir -parallel 4", "draw every line of the given file in 4 concurrent threads " +
                "and write the svg files to the directory specified by outDir")

                .footer("Developed by NIH/NCATS")
        ;


        if(spec.helpRequested(args)){
            System.out.println(spec.generateUsage());
            return;
        }
        try {
            Cli cli =spec.parse(args);
            MolRenderOptions options = settings.getOptions()
                    .showCarbons(cli.hasOption("showCarbons"))
                    .showImplicitHydrogens(cli.hasOption("showHydrogens"));

            if(cli.hasOption("s")){

                String svg = MolRender.render(cli.getOptionValue("s"), options);
                if(cli.hasOption("o")){
                    File outputFile = new File(cli.getOptionValue("o"));
                    File parent = outputFile.getParentFile();
                    if(parent !=null){
                        Files.createDirectories(parent.toPath());
                    }

                    try(PrintWriter writer = new PrintWriter(outputFile, "UTF-8")){
                        writer.println(svg);
                    }
                }else{
                    System.out.println(svg);
                }
            }else if(cli.hasOption("f")){
                File input = settings.getInputFile();

                File outputDir = settings.getOutputDir();
                if(outputDir ==null){
                    outputDir = Optional.ofNullable(input.getAbsoluteFile().getParentFile()).orElse(new File("."));
                }
                List<SmilesRecord> records = readRecords(input);
                if(records.isEmpty()){
                    System.out.println("No SMILES found");
                    return;
                }

                //we have to do this to make the compiler happy to use this inside a lambda
                final File effectivelyFinalOutputDir = outputDir;
                int numThreads = settings.getNumThreads();
                if(numThreads ==1){
                    //run in serial
                    for(SmilesRecord r : records){
                        try {
                            write(MolRender.renderResult(r.getSmiles(), options), r, effectivelyFinalOutputDir);
                        } catch (Throwable t) {
                            System.err.println("error processing line " + r.getLineNumber());
                            t.printStackTrace();
                        }
                    }
                }else {
                    ExecutorService executorService = Executors.newFixedThreadPool(numThreads);

                    CountDownLatch latch = new CountDownLatch(records.size());

                    for (SmilesRecord r : records) {
                        executorService.submit(new RenderCallable(r, options, latch,
                                result -> write(result, r, effectivelyFinalOutputDir)
                        ));
                    }
                    executorService.shutdown();
                    latch.await();
                }
            }else{
                //invalid
                throw new CliValidationException("smiles or file not specified");
            }
        }catch(CliValidationException e) {
            System.err.println(e.getMessage());
            System.err.println("\n\n" + spec.generateUsage());
            System.exit(-1);
        }

    }

    private static void write(MolRenderResult result, SmilesRecord r, File outputDir) throws IOException{
        if(result.hasError()){
            System.err.println("error rendering line " + r.getLineNumber() + " '" + r.getSmiles() + "': "
                    + result.getError().map(Throwable::getMessage).orElse(""));
        }
        File out = new File(outputDir, r.getOutputFileName());
        try (PrintWriter writer = new PrintWriter(out, "UTF-8")) {
            writer.println(result.getSvg());
        }
    }

    private static class RenderCallable implements Callable<Void>{
        SmilesRecord record;
        MolRenderOptions options;
        CountDownLatch latch;
        ThrowableConsumer<MolRenderResult, IOException> resultConsumer;
        RenderCallable(SmilesRecord record, MolRenderOptions options, CountDownLatch latch, ThrowableConsumer<MolRenderResult, IOException> resultConsumer){
            this.record = record;
            this.options = options;
            this.latch = latch;
            this.resultConsumer = resultConsumer;
        }

        @Override
        public Void call() throws Exception{
            try {
                resultConsumer.accept(MolRender.renderResult(record.getSmiles(), options));
                return null;
            }catch(IOException e){
                System.err.println("error writing line " + record.getLineNumber());
                e.printStackTrace();
                throw e;
            }finally{
                //wait until the end to decrement latch
                latch.countDown();
            }
        }
    }
}
