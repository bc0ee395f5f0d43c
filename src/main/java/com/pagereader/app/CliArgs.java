package com.pagereader.app;

import java.nio.file.Path;

/**
 * Аргументы командной строки. Допускаются оба вида: "-i page.png" и "--image=page.png".
 */
public record CliArgs(Path image, Path folder, boolean checkErrors, boolean saveOutput, boolean help) {

    public static final String USAGE = String.join("\n",
            "usage: page-reader (-i <image> | -d <folder>) [--no-check] [-o]",
            "  -i, --image <path>    recognize a single image",
            "  -d, --folder <dir>    recognize every supported image in a folder",
            "      --no-check        skip text correction",
            "  -o, --output          save recognized text (single image mode)",
            "  -h, --help            show this help");

    public boolean hasTarget() {
        return image != null || folder != null;
    }

    public static CliArgs parse(String[] args) {
        Path image = null, folder = null;
        boolean check = true, save = false, help = false;
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            String key = a, inline = null;
            int eq = a.indexOf('=');
            if (a.startsWith("--") && eq > 0) {
                key = a.substring(0, eq);
                inline = a.substring(eq + 1);
            }
            switch (key) {
                case "-i", "--image" -> {
                    String v = inline != null ? inline : value(args, ++i, key);
                    image = Path.of(v);
                }
                case "-d", "--folder" -> {
                    String v = inline != null ? inline : value(args, ++i, key);
                    folder = Path.of(v);
                }
                case "--no-check" -> check = false;
                case "-o", "--output" -> save = true;
                case "-h", "--help" -> help = true;
                default -> throw new IllegalArgumentException("unknown argument: " + a);
            }
        }
        return new CliArgs(image, folder, check, save, help);
    }

    private static String value(String[] args, int i, String key) {
        if (i >= args.length || args[i].isBlank() || args[i].startsWith("-")) {
            throw new IllegalArgumentException("missing value for " + key);
        }
        return args[i];
    }
}
