package org.ovsm.symbolic;

import com.microsoft.z3.*;
import lombok.Getter;
import org.ovsm.expressions.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 基于 Z3 的有效性判定器：在假设下检查目标公式是否必然成立。
 * 无法翻译为线性整数算术的假设被丢弃 (假设变弱，结论仍然可靠)，目标无法翻译时直接返回 UNKNOWN。
 * 持有一个 Z3 Context，使用完毕后需要 {@link #close()}。
 * @author Ayalyt
 */
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    public enum OracleResult {
        // 假设 ∧ ¬目标 不可满足
        VALID,
        // 存在满足假设但违反目标的模型 (可能是被丢弃的假设造成的)
        REFUTABLE,
        UNKNOWN
    }

    @Getter
    private final Context context;
    private final int timeoutMillis;

    public Z3Oracle(int timeoutMillis) {
        this.context = new Context();
        this.timeoutMillis = timeoutMillis;
        logger.debug("Z3Oracle 初始化完成，超时 {} ms", timeoutMillis);
    }

    /**
     * 检查 assumptions → goal 是否有效。
     */
    public OracleResult checkValidity(List<Formula> assumptions, Formula goal, SymbolicEnvironment env) {
        if (!goal.isZ3Translatable()) {
            logger.debug("目标 {} 无法翻译为 Z3，跳过", goal);
            return OracleResult.UNKNOWN;
        }
        Z3VariableManager varManager = new Z3VariableManager(context);
        Solver solver = context.mkSolver();
        Params params = context.mkParams();
        params.add("timeout", timeoutMillis);
        solver.setParameters(params);

        for (Formula assumption : assumptions) {
            for (Formula conjunct : assumption.conjuncts()) {
                if (conjunct.isZ3Translatable()) {
                    solver.add(conjunct.toZ3BoolExpr(context, varManager));
                } else {
                    logger.debug("丢弃无法翻译的假设: {}", conjunct);
                }
            }
        }
        solver.add(context.mkNot(goal.toZ3BoolExpr(context, varManager)));
        varManager.assertEnvironment(solver, env);

        Status status = check(solver);
        logger.debug("Z3 检查 {} → {}", goal, status);
        return switch (status) {
            case UNSATISFIABLE -> OracleResult.VALID;
            case SATISFIABLE -> OracleResult.REFUTABLE;
            case UNKNOWN -> OracleResult.UNKNOWN;
        };
    }

    private Status check(Solver solver) {
        try {
            return solver.check();
        } catch (Z3Exception e) {
            logger.warn("Z3 求解失败: {}", e.getMessage());
            return Status.UNKNOWN;
        }
    }

    @Override
    public void close() {
        context.close();
    }
}
