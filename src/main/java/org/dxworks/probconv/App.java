package org.dxworks.probconv;

import org.dxworks.probconv.exception.ParseException;
import org.dxworks.probconv.exception.RenderException;
import org.dxworks.probconv.model.Problem;
import org.dxworks.probconv.transform.CodeSubsumer;
import org.dxworks.probconv.transform.ImageCopier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.function.UnaryOperator;

public class App {

    public static void main(String[] args) throws Exception {
        int exitCode = run(args, ProbconvConfig.load());
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Converts the input file to the output file, picking parser and renderer from the file
     * extensions.
     *
     * @return the process exit code: 0 on success, 1 on a conversion error, 2 on bad usage
     */
    static int run(String[] args, ProbconvConfig config) throws IOException {
        if (args.length < 2) {
            System.err.println("Usage: java -jar probconv.jar <input-file> <output-file>");
            System.err.println("  <input-file>:  Problem in DSCTeX (.tex) or Gradescope Markdown (.md)");
            System.err.println("  <output-file>: Target file; .tex, .md, .html or .json");
            return 2;
        }

        Path input = Paths.get(args[0]);
        Path output = Paths.get(args[1]);

        Optional<Format> from = FormatDetector.detectFormat(input).filter(Format::isReadable);
        if (from.isEmpty()) {
            System.err.println("Error: Cannot read problems from " + input
                    + "; supported inputs: " + String.join(", ", FormatRegistry.parserNames()));
            return 2;
        }
        Optional<Format> to = FormatDetector.detectFormat(output).filter(Format::isWritable);
        if (to.isEmpty()) {
            System.err.println("Error: Cannot write problems to " + output
                    + "; supported outputs: " + String.join(", ", FormatRegistry.rendererNames()));
            return 2;
        }

        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            return 1;
        }

        System.out.println("Converting " + from.get().getName() + " to " + to.get().getName() + "...");
        System.out.println("Input: " + input.toAbsolutePath());

        Path sourceDir = input.toAbsolutePath().getParent();
        Path outputDir = output.toAbsolutePath().getParent();

        try {
            String source = Files.readString(input, StandardCharsets.UTF_8);
            Problem problem = FormatRegistry.createParser(from.get()).parse(source);

            if (config.isInlineCodeFiles()) {
                problem = CodeSubsumer.subsumeCode(problem, sourceDir);
            }
            if (config.isCopyImages()) {
                problem = ImageCopier.copyImages(problem, sourceDir, outputDir, imagePathTransform(config));
            }

            String rendered = FormatRegistry.createRenderer(to.get()).render(problem);
            Files.createDirectories(outputDir);
            Files.writeString(output, rendered, StandardCharsets.UTF_8);
        } catch (ParseException | RenderException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        System.out.println("Output: " + output.toAbsolutePath());
        return 0;
    }

    private static UnaryOperator<String> imagePathTransform(ProbconvConfig config) {
        String imageDirectory = config.getImageDirectory();
        if (imageDirectory == null) {
            return UnaryOperator.identity();
        }
        return path -> imageDirectory + "/" + Paths.get(path).getFileName();
    }
}
