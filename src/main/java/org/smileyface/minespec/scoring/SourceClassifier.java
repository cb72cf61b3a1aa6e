package org.smileyface.minespec.scoring;

import org.smileyface.minespec.config.SpecEngineConfig;
import org.smileyface.minespec.model.ContentType;
import org.smileyface.minespec.model.RawDocument;
import org.smileyface.minespec.model.SourceTier;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns a {@link SourceTier} to a document from its domain, using the configured domain lists.
 *
 * <ul>
 *   <li>the equipment brand's own domain: {@link SourceTier#OEM_PRIMARY}</li>
 *   <li>another manufacturer's domain, or a PDF brochure on an unlisted domain: {@link SourceTier#OEM_SECONDARY}</li>
 *   <li>spec databases and dealer or rental sites: {@link SourceTier#DEALER}</li>
 *   <li>industry publications: {@link SourceTier#THIRD_PARTY}</li>
 *   <li>anything else: {@link SourceTier#UNKNOWN}</li>
 * </ul>
 */
public class SourceClassifier {

    private final SpecEngineConfig.Domains domains;

    public SourceClassifier(SpecEngineConfig config) {
        this.domains = Objects.requireNonNull(config, "config").domains;
    }

    public SourceTier classify(RawDocument doc, String brand) {
        return classify(doc.getUrl(), doc.getContentType(), brand);
    }

    public SourceTier classify(String url, ContentType contentType, String brand) {
        String domain = RawDocument.domainOf(url == null ? "" : url);
        if (domain.isEmpty()) return SourceTier.UNKNOWN;

        List<String> own = brand == null ? null : domains.oem.get(brand.trim().toLowerCase(Locale.ROOT));
        if (own != null && matchesAny(domain, own)) {
            return SourceTier.OEM_PRIMARY;
        }
        for (Map.Entry<String, List<String>> e : domains.oem.entrySet()) {
            if (matchesAny(domain, e.getValue())) return SourceTier.OEM_SECONDARY;
        }
        if (matchesAny(domain, domains.specDatabases)) return SourceTier.DEALER;
        if (matchesAny(domain, domains.industryPublications)) return SourceTier.THIRD_PARTY;
        for (String pattern : domains.dealerPatterns) {
            if (domain.contains(pattern.toLowerCase(Locale.ROOT))) return SourceTier.DEALER;
        }
        if (contentType == ContentType.PDF || url.toLowerCase(Locale.ROOT).split("[?#]", 2)[0].endsWith(".pdf")) {
            return SourceTier.OEM_SECONDARY;
        }
        return SourceTier.UNKNOWN;
    }

    /** Exact domain or any subdomain of it. */
    static boolean matchesAny(String domain, Collection<String> candidates) {
        if (candidates == null) return false;
        for (String c : candidates) {
            String d = c.toLowerCase(Locale.ROOT);
            if (domain.equals(d) || domain.endsWith("." + d)) return true;
        }
        return false;
    }
}
