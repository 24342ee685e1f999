package io.github.eutro.bin2ast.core.passes.convert;

import io.github.eutro.bin2ast.core.ast.AstBuilder;
import io.github.eutro.bin2ast.core.ast.AstUtil;
import io.github.eutro.bin2ast.core.ast.BlockStmt;
import io.github.eutro.bin2ast.core.ast.StmtLabel;
import io.github.eutro.bin2ast.core.cfg.Cfg;
import io.github.eutro.bin2ast.core.graph.NodeId;
import io.github.eutro.bin2ast.core.passes.IRPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A pass that lowers a {@link Cfg} to statements, with the {@link LoweringStrategy strategy} of its options.
 * <p>
 * If structuring meets a switch whose cases cannot be resolved, and the options allow it,
 * the function is lowered with {@link LowerCfgDirect} instead.
 */
public class LowerCfg implements IRPass<Cfg, LoweredFunction> {
    private static final Logger LOGGER = LoggerFactory.getLogger(LowerCfg.class);

    private final LoweringOptions options;

    /**
     * Construct a lowering pass.
     *
     * @param options The options.
     */
    public LowerCfg(LoweringOptions options) {
        this.options = options;
    }

    public LoweringOptions options() {
        return options;
    }

    @Override
    public LoweredFunction run(Cfg cfg) {
        LoweringStrategy strategy = options.strategy();
        if (strategy == LoweringStrategy.REDUCIBLE_ONLY) {
            strategy = cfg.isReducible() ? LoweringStrategy.STRUCTURED : LoweringStrategy.LEGACY;
            LOGGER.debug("function {} is {}reducible, lowering {}",
                    cfg.faddr(), strategy == LoweringStrategy.STRUCTURED ? "" : "not ", strategy);
        }
        if (strategy == LoweringStrategy.STRUCTURED) {
            try {
                return structured(cfg);
            } catch (UnresolvedSwitchException e) {
                if (!options.fallBackOnUnresolvedSwitch()) throw e;
                LOGGER.warn("Function {}: {}; falling back to legacy lowering", cfg.faddr(), e.getMessage());
            }
        }
        return legacy(cfg);
    }

    private LoweredFunction structured(Cfg cfg) {
        Set<NodeId> labels = StructureCfg.collectLabels(cfg, options);
        AstBuilder b = new AstBuilder(options.labelPrefix());
        BlockStmt body = StructureCfg.structure(cfg, labels, b, options);
        LOGGER.debug("structured function {} into {} statements with {} gotos",
                cfg.faddr(), b.stmtCount(), AstUtil.countGotos(body));
        return new LoweredFunction(cfg.faddr(), body, LoweringStrategy.STRUCTURED, labels, b.spans());
    }

    private LoweredFunction legacy(Cfg cfg) {
        AstBuilder b = new AstBuilder(options.labelPrefix());
        BlockStmt body = LowerCfgDirect.lower(cfg, b);
        Set<NodeId> labels = new TreeSet<>();
        for (StmtLabel label : AstUtil.labels(body)) {
            labels.add(label.target());
        }
        LOGGER.debug("lowered function {} directly into {} statements", cfg.faddr(), b.stmtCount());
        return new LoweredFunction(cfg.faddr(), body, LoweringStrategy.LEGACY,
                Collections.unmodifiableSet(labels), b.spans());
    }
}
