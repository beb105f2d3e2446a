package com.ciro.ncl;

import java.util.Locale;

/**
 * Esqueleto del documento: apertura/cierre y la inyección de estilos en el head.
 */
public final class DocumentShell {

    static final String TAILWIND_CDN = "<script src=\"https://cdn.tailwindcss.com\"></script>";

    private DocumentShell() {}

    public static String open(String title) {
        return "<!DOCTYPE html>\n"
                + "<html lang=\"en\">\n"
                + "<head>\n"
                + "<meta charset=\"UTF-8\">\n"
                + "<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n"
                + "<title>" + (title == null ? "" : title) + "</title>\n"
                + "</head>\n"
                + "<body>\n";
    }

    public static String close() {
        return "\n</body>\n</html>";
    }

    /**
     * Envuelve un fragmento suelto y mete {@code <style>} (y Tailwind si se pidió)
     * antes del cierre de {@code <head>}.
     */
    public static String finish(String html, String css, String title, CompileOptions options) {
        String doc = html == null ? "" : html;
        String lower = doc.toLowerCase(Locale.ROOT);

        if (!lower.contains("<html")) {
            doc = open(title != null ? title : options.defaultTitle()) + doc.strip() + close();
            lower = doc.toLowerCase(Locale.ROOT);
        }

        StringBuilder head = new StringBuilder();
        if (options.tailwind()) head.append(TAILWIND_CDN).append('\n');
        head.append("<style>\n").append(css).append("\n</style>\n");

        int headClose = lower.indexOf("</head>");
        if (headClose >= 0) {
            return doc.substring(0, headClose) + head + doc.substring(headClose);
        }

        // documento con <html> pero sin <head>
        int htmlOpen = lower.indexOf("<html");
        int tagEnd = doc.indexOf('>', htmlOpen);
        if (tagEnd < 0) return doc;
        return doc.substring(0, tagEnd + 1) + "\n<head>\n" + head + "</head>" + doc.substring(tagEnd + 1);
    }
}
