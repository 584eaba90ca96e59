package com.framejoin.merge;

import com.framejoin.engine.JoinEngineAdapter;
import com.framejoin.engine.JoinRequest;
import com.framejoin.engine.KeySelection;
import com.framejoin.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Merges two tables: the public entry point of the merge subsystem.
 *
 * <p>A merge runs these stages in order, failing before the engine is called when
 * the request is invalid:
 * <pre>
 *   MergeValidator → SuffixResolver → TypeUnifier → JoinEngineAdapter → ResultAssembler
 * </pre>
 *
 * <p>The input tables are never modified, so a table may take part in several
 * merges. A merge call blocks until the engine returns.
 *
 * <p>Example usage:
 * <pre>
 *   try (DuckDBJoinEngine engine = DuckDBJoinEngine.create()) {
 *       Merger merger = new Merger(engine);
 *       Table joined = merger.merge(orders, customers,
 *           MergeSpec.builder().on("customer_id").how("left").suffixes("_o", "_c").build());
 *   }
 * </pre>
 */
public class Merger {

    private static final Logger logger = LoggerFactory.getLogger(Merger.class);

    private final JoinEngineAdapter engine;

    /**
     * Creates a merger that executes joins on the given engine.
     *
     * @param engine the join engine
     */
    public Merger(JoinEngineAdapter engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * Merges two tables.
     *
     * @param left the left table
     * @param right the right table
     * @param spec the merge specification
     * @return the merged table
     * @throws com.framejoin.exception.MergeException if the request is invalid
     * @throws com.framejoin.exception.CastException if a key cannot be cast to its unified dtype
     * @throws com.framejoin.exception.EngineExecutionException if the engine fails
     */
    public Table merge(Table left, Table right, MergeSpec spec) {
        return mergeWithReport(left, right, spec).table();
    }

    /**
     * Merges two tables and reports the precision warnings of this call.
     *
     * @param left the left table
     * @param right the right table
     * @param spec the merge specification
     * @return the merged table and warnings
     */
    public MergeReport mergeWithReport(Table left, Table right, MergeSpec spec) {
        long startTime = System.nanoTime();

        JoinKeys keys = MergeValidator.validate(left, right, spec);
        JoinKind kind = spec.joinKind();
        logger.debug("Validated merge {} with {}", spec, keys);

        ResolvedInputs resolved = SuffixResolver.resolve(left, right, keys, spec.lsuffix(), spec.rsuffix());
        UnifiedInputs unified = TypeUnifier.unify(resolved, kind);

        JoinKeys resolvedKeys = unified.keys();
        JoinRequest request = new JoinRequest(
            unified.left(),
            unified.right(),
            resolvedKeys.leftIndex() ? KeySelection.index() : KeySelection.columns(resolvedKeys.leftOn()),
            resolvedKeys.rightIndex() ? KeySelection.index() : KeySelection.columns(resolvedKeys.rightOn()),
            kind,
            resolvedKeys.leftIndex(),
            resolvedKeys.rightIndex());
        Table engineOutput = engine.join(request);

        Table result = ResultAssembler.assemble(engineOutput, unified, spec.sort());

        long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.info("Merged {} x {} rows ({} join on {} key(s)) into {} rows in {} ms",
            left.numRows(), right.numRows(), kind, request.leftKeys().size(), result.numRows(), elapsedMs);
        return new MergeReport(result, unified.warnings());
    }
}
