package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.identifier.ArticleIdentifier;
import com.simpla.reconciliation.model.AmendmentAction;
import com.simpla.reconciliation.model.Article;
import com.simpla.reconciliation.model.Capitulo;
import com.simpla.reconciliation.model.DictamenOperation;
import com.simpla.reconciliation.model.Ley;
import com.simpla.reconciliation.model.ReconciledArticle;
import com.simpla.reconciliation.model.ReconciledLey;
import com.simpla.reconciliation.model.Titulo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reconciles a statute against the operations of a dictamen.
 * <p>
 * A run is a pure function of its inputs: nothing is mutated and no state survives the
 * call, so one engine can serve concurrent runs. Operations that cannot be applied are
 * reported as {@link Diagnostic}s and left out; they never abort the run.
 */
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final TargetResolver resolver;
    private final ChapterExpander expander;
    private final IncorporationDeduplicator deduplicator;
    private final ReconciliationMerge merge;
    private final ViewAssembler assembler;
    private final Clock clock;

    public ReconciliationEngine() {
        this(TargetConflictPolicy.PREFER_EXPLICIT, Collections.emptyList());
    }

    public ReconciliationEngine(TargetConflictPolicy conflictPolicy, List<ChapterOverride> overrides) {
        this(new TargetResolver(conflictPolicy), new ChapterExpander(overrides), new IncorporationDeduplicator(),
                new ReconciliationMerge(), new ViewAssembler(), Clock.systemDefaultZone());
    }

    public ReconciliationEngine(TargetResolver resolver, ChapterExpander expander, IncorporationDeduplicator deduplicator,
                                ReconciliationMerge merge, ViewAssembler assembler, Clock clock) {
        this.resolver = resolver;
        this.expander = expander;
        this.deduplicator = deduplicator;
        this.merge = merge;
        this.assembler = assembler;
        this.clock = clock;
    }

    public ReconciliationResult reconcile(Ley ley, List<DictamenOperation> dictamen) throws MalformedInputException {
        validate(ley, dictamen);

        Run run = new Run(StatuteIndex.of(ley));
        for (int i = 0; i < dictamen.size(); i++) {
            classify(run, i, dictamen.get(i));
        }
        dropUnknownTargets(run);

        List<ViewAssembler.PlacedArticle> placed = new ArrayList<>();
        for (StatuteIndex.Entry entry : run.index.getEntries()) {
            placed.add(place(run, entry));
        }
        for (ChapterExpansion expansion : run.expansions.values()) {
            for (StatuteIndex.Entry entry : expansion.getSyntheticEntries()) {
                placed.add(place(run, entry));
            }
        }
        for (ArticleIdentifier identifier : run.newArticles) {
            ViewAssembler.Placement placement = assembler.placeIncorporation(identifier, run.index);
            if (placement == null) {
                for (TargetedOperation op : run.byArticle.get(identifier)) {
                    run.report(op.getIndex(), op.getOperation(), DiagnosticType.UNPLACED_ARTICLE, identifier.label(),
                            "La ley no tiene títulos donde ubicar el artículo incorporado");
                }
                continue;
            }
            ReconciledArticle article = merge.merge(identifier, null,
                    placement.getTitulo().getNumero(),
                    placement.getCapitulo() != null ? placement.getCapitulo().getNumero() : null,
                    run.byArticle.get(identifier), false);
            placed.add(new ViewAssembler.PlacedArticle(article, placement));
        }

        ReconciledLey reconciled = assembler.assemble(ley, placed, run.repealedChapters);
        ReconciliationResult result = new ReconciliationResult(reconciled, metadata(run, reconciled),
                run.diagnostics, run.skippedOperations());

        log.info("Reconciled ley {}: {} sustituidos, {} incorporados, {} derogados, {} operaciones omitidas",
                ley.getNumero(),
                result.getMetadatos().getTotalSustituciones(),
                result.getMetadatos().getTotalIncorporaciones(),
                result.getMetadatos().getTotalDerogaciones(),
                result.getMetadatos().getOperacionesOmitidas());
        return result;
    }

    private void classify(Run run, int index, DictamenOperation operation) {
        AmendmentAction action = operation.getAction();
        if (action == null) {
            run.report(index, operation, DiagnosticType.UNSUPPORTED_ACTION, null,
                    "Acción no soportada: " + operation.getAccion());
            return;
        }

        ResolvedTarget target = resolver.resolve(operation);
        if (target == null) {
            run.report(index, operation, DiagnosticType.UNRESOLVED_TARGET, null,
                    "No se pudo determinar el artículo destino");
            return;
        }
        if (target.getDiscarded() != null) {
            run.report(index, operation, DiagnosticType.TARGET_MISMATCH, target.describe(),
                    "El destino explícito y el texto nuevo no coinciden; se descartó el artículo "
                            + target.getDiscarded().label() + " (" + resolver.getConflictPolicy() + ")");
        }

        TargetedOperation targeted = new TargetedOperation(index, operation, action, target);
        if (target.isChapter()) {
            expandChapter(run, targeted);
            return;
        }

        ArticleIdentifier identifier = target.getArticle();
        if (action == AmendmentAction.INCORPORATE && target.getInciso() == null
                && deduplicator.isGenuinelyNew(identifier, run.index)) {
            run.newArticles.add(identifier);
        }
        run.byArticle.computeIfAbsent(identifier, k -> new ArrayList<>()).add(targeted);
    }

    private void expandChapter(Run run, TargetedOperation targeted) {
        DictamenOperation operation = targeted.getOperation();
        String chapter = targeted.getTarget().getChapter();
        if (targeted.getAction() != AmendmentAction.REPEAL) {
            run.report(targeted.getIndex(), operation, DiagnosticType.UNSUPPORTED_ACTION, targeted.getTarget().describe(),
                    "Sólo se admite la derogación de capítulos completos");
            return;
        }

        String key = StatuteIndex.normalize(chapter);
        ChapterExpansion expansion = run.expansions.get(key);
        if (expansion == null) {
            expansion = expander.expand(chapter, run.index);
        }
        if (expansion.getOutcome() == ChapterExpansion.Outcome.UNRESOLVED) {
            run.report(targeted.getIndex(), operation, DiagnosticType.UNRESOLVED_CHAPTER, targeted.getTarget().describe(),
                    "El capítulo " + chapter + " no tiene artículos en la ley y no hay un reemplazo manual configurado");
            return;
        }
        if (expansion.getOutcome() == ChapterExpansion.Outcome.UNPLACED) {
            run.report(targeted.getIndex(), operation, DiagnosticType.UNPLACED_ARTICLE, targeted.getTarget().describe(),
                    "El reemplazo manual del capítulo " + chapter + " apunta a un título inexistente");
            return;
        }

        run.expansions.put(key, expansion);
        run.repealedChapters.addAll(expansion.getChapters());
        for (ArticleIdentifier identifier : expansion.getIdentifiers()) {
            run.chapterRepealed.add(identifier);
            run.byArticle.computeIfAbsent(identifier, k -> new ArrayList<>()).add(targeted);
        }
    }

    /**
     * Substitutions and repeals of articles that neither the statute nor an incorporation provides.
     */
    private void dropUnknownTargets(Run run) {
        Set<ArticleIdentifier> known = new LinkedHashSet<>(run.newArticles);
        for (StatuteIndex.Entry entry : run.index.getEntries()) {
            known.add(entry.getIdentifier());
        }
        for (ChapterExpansion expansion : run.expansions.values()) {
            known.addAll(expansion.getIdentifiers());
        }

        Iterator<Map.Entry<ArticleIdentifier, List<TargetedOperation>>> it = run.byArticle.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<ArticleIdentifier, List<TargetedOperation>> entry = it.next();
            if (known.contains(entry.getKey())) {
                continue;
            }
            for (TargetedOperation op : entry.getValue()) {
                run.report(op.getIndex(), op.getOperation(), DiagnosticType.UNKNOWN_ARTICLE, op.getTarget().describe(),
                        "El artículo " + entry.getKey().label() + " no existe en la ley");
            }
            it.remove();
        }
    }

    private ViewAssembler.PlacedArticle place(Run run, StatuteIndex.Entry entry) {
        Titulo titulo = entry.getTitulo();
        Capitulo capitulo = entry.getCapitulo();
        Article article = entry.getArticle();
        ReconciledArticle reconciled = merge.merge(entry.getIdentifier(), article,
                titulo.getNumero(),
                capitulo != null ? capitulo.getNumero() : null,
                run.byArticle.getOrDefault(entry.getIdentifier(), Collections.emptyList()),
                run.chapterRepealed.contains(entry.getIdentifier()));
        return new ViewAssembler.PlacedArticle(reconciled, new ViewAssembler.Placement(titulo, capitulo));
    }

    private ReconciliationMetadata metadata(Run run, ReconciledLey reconciled) {
        int substituted = 0;
        int incorporated = 0;
        int repealed = 0;
        int unchanged = 0;
        for (ReconciledArticle article : reconciled.allArticles()) {
            switch (article.getEstado()) {
                case SUBSTITUTED:
                    substituted++;
                    break;
                case INCORPORATED:
                    incorporated++;
                    break;
                case REPEALED:
                    repealed++;
                    break;
                default:
                    unchanged++;
            }
        }
        List<String> chapters = new ArrayList<>();
        for (ChapterExpansion expansion : run.expansions.values()) {
            chapters.add(expansion.getChapter());
        }
        return new ReconciliationMetadata(substituted, incorporated, repealed, unchanged, chapters,
                run.skipped.size(), LocalDateTime.now(clock));
    }

    static void validate(Ley ley, List<DictamenOperation> dictamen) throws MalformedInputException {
        if (ley == null) {
            throw new MalformedInputException("Invalid data format: 'ley' field not found");
        }
        if (ley.getTitulos() == null) {
            throw new MalformedInputException("Invalid data format: 'ley.titulos' field not found");
        }
        for (int t = 0; t < ley.getTitulos().size(); t++) {
            Titulo titulo = ley.getTitulos().get(t);
            if (titulo == null) {
                throw new MalformedInputException("Invalid data format: null título at position " + t);
            }
            if (titulo.getArticulos().contains(null)) {
                throw new MalformedInputException("Invalid data format: null artículo in título " + titulo.getNumero());
            }
            for (Capitulo capitulo : titulo.getCapitulos()) {
                if (capitulo == null) {
                    throw new MalformedInputException("Invalid data format: null capítulo in título " + titulo.getNumero());
                }
                if (capitulo.getArticulos().contains(null)) {
                    throw new MalformedInputException("Invalid data format: null artículo in capítulo " + capitulo.getNumero());
                }
            }
        }
        if (dictamen == null) {
            throw new MalformedInputException("Invalid data format: 'dictamen' field not found");
        }
        if (dictamen.contains(null)) {
            throw new MalformedInputException("Invalid data format: null operation in 'dictamen'");
        }
    }

    /**
     * Working state of one reconciliation; discarded when {@link #reconcile} returns.
     */
    private static final class Run {
        private final StatuteIndex index;
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Map<Integer, DictamenOperation> skipped = new LinkedHashMap<>();
        private final Map<ArticleIdentifier, List<TargetedOperation>> byArticle = new LinkedHashMap<>();
        private final Set<ArticleIdentifier> chapterRepealed = new LinkedHashSet<>();
        private final Set<ArticleIdentifier> newArticles = new LinkedHashSet<>();
        private final Map<String, ChapterExpansion> expansions = new LinkedHashMap<>();
        private final Set<Capitulo> repealedChapters = Collections.newSetFromMap(new IdentityHashMap<>());

        private Run(StatuteIndex index) {
            this.index = index;
        }

        private void report(int position, DictamenOperation operation, DiagnosticType type, String target, String message) {
            Diagnostic diagnostic = new Diagnostic(type, position, operation.getDictamenArticulo(), target, message);
            log.debug("{}", diagnostic);
            diagnostics.add(diagnostic);
            if (type.skipsOperation()) {
                skipped.put(position, operation);
            }
        }

        private List<DictamenOperation> skippedOperations() {
            List<DictamenOperation> operations = new ArrayList<>();
            for (Integer position : new TreeSet<>(skipped.keySet())) {
                operations.add(skipped.get(position));
            }
            return operations;
        }
    }
}
