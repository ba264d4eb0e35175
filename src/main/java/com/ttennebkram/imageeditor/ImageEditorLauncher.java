package com.ttennebkram.imageeditor;

import com.google.gson.JsonParseException;
import com.ttennebkram.imageeditor.config.EditorSettings;
import com.ttennebkram.imageeditor.io.OpenCvLoader;
import com.ttennebkram.imageeditor.io.RasterImageIO;
import com.ttennebkram.imageeditor.model.FilterParameters;
import com.ttennebkram.imageeditor.model.FilterType;
import com.ttennebkram.imageeditor.model.ImageEditException;
import com.ttennebkram.imageeditor.processors.FilterProcessor;
import com.ttennebkram.imageeditor.processors.FilterProcessorRegistry;
import com.ttennebkram.imageeditor.serialization.EditRecipe;
import com.ttennebkram.imageeditor.serialization.RecipeSerializer;
import com.ttennebkram.imageeditor.session.EditSession;
import com.ttennebkram.imageeditor.session.ImageEditorService;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.LogManager;

/**
 * Command line front end: run one filter, a saved recipe, or every filter over an image file.
 */
public class ImageEditorLauncher {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  image-editor <input> <output> --filter <name> [--brightness n] [--contrast n] [--radius n]",
            "  image-editor <input> <output> --recipe <recipe.json>",
            "  image-editor <input> --all <outputDir>",
            "Options:",
            "  --quality n   JPEG quality 1-100 (default 95)",
            "  --help        show this message",
            "Filters:",
            filterList());

    public static void main(String[] args) {
        installLogging();
        System.exit(run(args));
    }

    /**
     * Parse the arguments and run; returns the process exit status.
     */
    static int run(String[] args) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        if (options.help) {
            System.out.println(USAGE);
            return EXIT_OK;
        }

        if (!OpenCvLoader.tryLoad()) {
            System.err.println("Error: could not load the OpenCV native library");
            return EXIT_FAILURE;
        }

        EditorSettings settings = EditorSettings.load();
        if (options.quality != null) {
            settings.setJpegQuality(options.quality);
        }
        ImageEditorService service = new ImageEditorService(new RasterImageIO(), settings);

        try {
            EditSession session = service.openImage(options.input);
            if (options.allDir != null) {
                writeAllFilters(service, session, options.allDir);
            } else if (options.recipe != null) {
                EditRecipe recipe = RecipeSerializer.load(options.recipe);
                service.applyRecipe(session, recipe);
                service.saveImage(session, options.output);
                System.out.println("Applied " + recipe.size() + " step(s), saved " + options.output);
            } else {
                service.applyFilter(session, options.filter, options.parameters);
                service.saveImage(session, options.output);
                System.out.println("Applied " + options.filter.getDisplayName() + ", saved " + options.output);
            }
            return EXIT_OK;
        } catch (IOException | JsonParseException | ImageEditException e) {
            System.err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * One output per filter, each applied to the original and then undone.
     */
    private static void writeAllFilters(ImageEditorService service, EditSession session, Path outDir)
            throws IOException {
        Files.createDirectories(outDir);
        FilterParameters params = new FilterParameters(10, 20, 3);

        String[] names = {"grayscale.png", "sepia.png", "edges.png", "adjusted.png", "blurred.png"};
        FilterType[] types = {FilterType.GRAYSCALE, FilterType.SEPIA, FilterType.EDGE_DETECTION,
                FilterType.BRIGHTNESS_CONTRAST, FilterType.GAUSSIAN_BLUR};

        for (int i = 0; i < types.length; i++) {
            service.applyFilter(session, types[i], params);
            Path out = outDir.resolve(names[i]);
            service.saveImage(session, out);
            service.undo(session);
            System.out.println("Wrote " + out);
        }
    }

    private static void installLogging() {
        try (InputStream in = ImageEditorLauncher.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("[Launcher] Could not read logging.properties: " + e.getMessage());
        }
    }

    private static String filterList() {
        List<String> lines = new ArrayList<>();
        for (FilterType type : FilterType.values()) {
            FilterProcessor processor = FilterProcessorRegistry.get(type);
            String summary = processor.getDescription().split("\n")[0];
            lines.add(String.format("  %-20s %-8s %s", type.getDisplayName(), processor.getCategory(), summary));
        }
        return String.join(System.lineSeparator(), lines);
    }

    static final class Options {
        Path input;
        Path output;
        Path recipe;
        Path allDir;
        FilterType filter;
        FilterParameters parameters = FilterParameters.defaults();
        Integer quality;
        boolean help;

        static Options parse(String[] args) {
            Options options = new Options();
            List<String> positional = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--help":
                    case "-h":
                        options.help = true;
                        return options;
                    case "--filter":
                        options.filter = FilterType.fromName(value(args, ++i, arg));
                        break;
                    case "--recipe":
                        options.recipe = Paths.get(value(args, ++i, arg));
                        break;
                    case "--all":
                        options.allDir = Paths.get(value(args, ++i, arg));
                        break;
                    case "--brightness":
                        options.parameters = options.parameters.withBrightness(number(args, ++i, arg));
                        break;
                    case "--contrast":
                        options.parameters = options.parameters.withContrast(number(args, ++i, arg));
                        break;
                    case "--radius":
                        options.parameters = options.parameters.withBlurRadius(integer(args, ++i, arg));
                        break;
                    case "--quality":
                        options.quality = integer(args, ++i, arg);
                        break;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        positional.add(arg);
                }
            }

            int modes = (options.filter != null ? 1 : 0) + (options.recipe != null ? 1 : 0)
                    + (options.allDir != null ? 1 : 0);
            if (modes != 1) {
                throw new IllegalArgumentException("Specify exactly one of --filter, --recipe or --all");
            }
            int expected = options.allDir != null ? 1 : 2;
            if (positional.size() != expected) {
                throw new IllegalArgumentException("Expected " + expected + " file argument(s), got "
                        + positional.size());
            }
            options.input = Paths.get(positional.get(0));
            if (expected == 2) {
                options.output = Paths.get(positional.get(1));
            }
            return options;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        private static int integer(String[] args, int index, String option) {
            String text = value(args, index, option);
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not an integer for " + option + ": " + text);
            }
        }

        private static double number(String[] args, int index, String option) {
            String text = value(args, index, option);
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number for " + option + ": " + text);
            }
        }
    }
}
