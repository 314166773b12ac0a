package org.netpreserve.docketcrawl;

import org.netpreserve.docketcrawl.page.DocumentRow;
import org.netpreserve.docketcrawl.page.TabSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Lazy, restartable listing of one tab's documents. Each {@link #iterator()} opens the tab afresh and re-reads the
 * page counts, since page numbering isn't stable across sessions. Pages are visited in increasing order; a document
 * listed twice within one section is reported once. On the cards tab each instance is its own section, so a
 * document filed under two instances is reported for both; deduplication across them is up to the caller.
 * <p>
 * A tab whose markup doesn't match ends the pass early; the mismatch is logged and kept in {@link #mismatches()}.
 */
public class TabListing implements Iterable<DocumentReference> {
    private static final Logger log = LoggerFactory.getLogger(TabListing.class);
    private final NavigationEngine engine;
    private final SourceTab tab;
    private final String identityMarker;
    private final Map<String, InstanceRecord> instances = new LinkedHashMap<>();
    private final List<String> mismatches = new ArrayList<>();

    TabListing(NavigationEngine engine, SourceTab tab, String identityMarker) {
        this.engine = engine;
        this.tab = tab;
        this.identityMarker = identityMarker;
    }

    public SourceTab tab() {
        return tab;
    }

    /**
     * Instances seen so far, in tab order.
     */
    public Collection<InstanceRecord> instances() {
        return List.copyOf(instances.values());
    }

    public List<String> mismatches() {
        return List.copyOf(mismatches);
    }

    /**
     * @throws RateLimitedException      (from the iterator) if a throttling page appears
     * @throws SessionLostException      (from the iterator) if the case card can't be reloaded
     * @throws CrawlInterruptedException (from the iterator) if the thread is interrupted
     */
    @Override
    public Iterator<DocumentReference> iterator() {
        return new Pass();
    }

    private class Pass implements Iterator<DocumentReference> {
        private final Deque<DocumentReference> buffer = new ArrayDeque<>();
        private final Set<String> seen = new HashSet<>();
        private List<? extends TabSection> sections;
        private int sectionIndex = -1;
        private TabSection section;
        private String instanceId;
        private int page;
        private int maxPage;
        private int position;
        private int listed;
        private boolean finished;

        @Override
        public boolean hasNext() {
            try {
                while (buffer.isEmpty() && !finished) {
                    advance();
                }
            } catch (ParseMismatchException e) {
                log.atWarn().addKeyValue("tab", tab.key()).log("Tab structure mismatch, skipping the rest of the tab: {}",
                        e.getMessage());
                mismatches.add(e.getMessage());
                finished = true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CrawlInterruptedException("Interrupted while listing " + tab.key(), e);
            }
            return !buffer.isEmpty();
        }

        @Override
        public DocumentReference next() {
            if (!hasNext()) throw new NoSuchElementException();
            return buffer.removeFirst();
        }

        private void advance() throws InterruptedException {
            if (sections == null) {
                sections = engine.openTab(tab).sections();
                log.atInfo().addKeyValue("tab", tab.key()).addKeyValue("sections", sections.size()).log("Opened tab");
                return;
            }
            if (section == null) {
                sectionIndex++;
                if (sectionIndex >= sections.size()) {
                    finished = true;
                    log.atInfo().addKeyValue("tab", tab.key()).addKeyValue("documents", listed).log("Listed tab");
                    return;
                }
                section = sections.get(sectionIndex);
                var instance = section.instance();
                instanceId = instance == null ? null : instance.instanceId();
                if (instance != null) instances.putIfAbsent(instance.instanceId(), instance);
                position = 0;
                page = 0;
                seen.clear();
                add(section.headerRows(), 0);
                maxPage = engine.openSection(section);
                if (maxPage > 1) {
                    log.atDebug().addKeyValue("tab", tab.key()).addKeyValue("instance", instanceId)
                            .addKeyValue("pages", maxPage).log("Paginated section");
                }
                return;
            }
            page++;
            if (page > maxPage) {
                section = null;
                return;
            }
            if (page > 1) {
                engine.showPage(section, page);
            }
            add(section.rows(), page);
        }

        private void add(List<DocumentRow> rows, int page) {
            for (DocumentRow row : rows) {
                String key = DocumentIdentity.fromUrl(row.url(), identityMarker).key();
                if (!seen.add(key)) continue;
                position++;
                listed++;
                buffer.addLast(DocumentReference.of(row.url(), identityMarker, tab, instanceId, page, position)
                        .withRowDetails(row.title(), row.signed(), row.signatureValid(), row.judge(), row.court()));
            }
        }
    }
}
