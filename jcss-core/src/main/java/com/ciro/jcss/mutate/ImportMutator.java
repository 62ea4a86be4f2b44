package com.ciro.jcss.mutate;

import com.ciro.jcss.ast.AtRule;
import com.ciro.jcss.ast.CssItem;
import com.ciro.jcss.ast.Stylesheet;

import java.util.ArrayList;
import java.util.List;

/** Alta y baja de {@code @import} en el nivel superior. */
public final class ImportMutator {

    private static final String IMPORT = "import";
    private static final String CHARSET = "charset";

    /**
     * Agrega {@code @import} salvo que otro ya mencione la URL. Va después del último
     * {@code @import}; si no hay, después de un {@code @charset} inicial; si no, al principio.
     */
    public Stylesheet addImport(Stylesheet sheet, String url, String media) {
        List<CssItem> items = new ArrayList<>(sheet.items());
        int lastImport = -1;
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i) instanceof AtRule at && IMPORT.equals(at.keyword())) {
                if (at.prelude().contains(url)) return sheet;
                lastImport = i;
            }
        }

        AtRule rule = AtRule.statement(IMPORT, prelude(url, media));
        if (lastImport >= 0) {
            items.add(lastImport + 1, rule);
        } else if (!items.isEmpty() && items.get(0) instanceof AtRule first && CHARSET.equals(first.keyword())) {
            items.add(1, rule);
        } else {
            items.add(0, rule);
        }
        return new Stylesheet(items);
    }

    /** Quita todo {@code @import} cuyo prelude contenga la URL. */
    public Stylesheet removeImport(Stylesheet sheet, String url) {
        List<CssItem> items = new ArrayList<>(sheet.items().size());
        for (CssItem item : sheet.items()) {
            if (item instanceof AtRule at && IMPORT.equals(at.keyword()) && at.prelude().contains(url)) continue;
            items.add(item);
        }
        return new Stylesheet(items);
    }

    static String prelude(String url, String media) {
        boolean absolute = url.startsWith("http://") || url.startsWith("https://") || url.startsWith("/");
        String target = absolute ? "url('" + url + "')" : "'" + url + "'";
        return media == null || media.isBlank() ? target : target + " " + media.trim();
    }
}
