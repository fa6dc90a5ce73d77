package fun.fengwk.lss.core.service.search.support;

import org.springframework.stereotype.Component;

/**
 * Reduces a reading list title to a catalog search key.
 *
 * <p>Export titles often carry series or subtitle annotations that hurt catalog matching, e.g.
 * {@code Going Postal (Discworld, #33; Moist von Lipwig, #1)} becomes {@code Going Postal} and
 * {@code The First 90 Days: Critical Success Strategies} becomes {@code The First 90 Days}.
 *
 * @author fengwk
 */
@Component
public class TitleNormalizer {

    public String normalize(String title) {
        if (title == null) {
            return "";
        }
        int cut = title.length();
        int colon = title.indexOf(':');
        if (colon >= 0) {
            cut = colon;
        }
        int paren = title.indexOf('(');
        if (paren >= 0 && paren < cut) {
            cut = paren;
        }
        return title.substring(0, cut).trim();
    }

}
