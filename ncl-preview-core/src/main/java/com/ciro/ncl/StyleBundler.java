package com.ciro.ncl;

import com.helger.css.ECSSVersion;
import com.helger.css.decl.CascadingStyleSheet;
import com.helger.css.reader.CSSReader;
import com.helger.css.writer.CSSWriter;
import com.helger.css.writer.CSSWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hoja base + CSS del autor en un único bloque, minificado opcionalmente.
 */
public final class StyleBundler {

    private static final Logger log = LoggerFactory.getLogger(StyleBundler.class);

    private StyleBundler() {}

    public static String bundle(String authorCss, boolean minify) {
        String css = BaseStyles.CSS;
        if (authorCss != null && !authorCss.isBlank()) {
            css = css + "\n/* custom */\n" + authorCss.strip() + "\n";
        }
        return minify ? minify(css) : css;
    }

    /** CSS que ph-css no sabe leer se devuelve tal cual. */
    public static String minify(String css) {
        if (css == null || css.isBlank()) return "";
        try {
            CascadingStyleSheet sheet = CSSReader.readFromString(css, ECSSVersion.CSS30);
            if (sheet == null) {
                log.debug("Style text not parseable, keeping it unminified");
                return css;
            }
            CSSWriter writer = new CSSWriter(new CSSWriterSettings(ECSSVersion.CSS30, true));
            writer.setWriteHeaderText(false);
            return writer.getCSSAsString(sheet);
        } catch (RuntimeException e) {
            log.debug("Minification failed, keeping raw style text: {}", e.toString());
            return css;
        }
    }
}
