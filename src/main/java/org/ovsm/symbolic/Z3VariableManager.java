package org.ovsm.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Solver;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.*;

/**
 * 负责管理公式中的变量名到 Z3 整数常量的映射。
 * 确保每个变量在 Z3 Context 中有唯一的对应 Z3 变量。
 * 在 Solver 初始化时，断言符号环境中已知的常量、区间和数组大小。
 * @author Ayalyt
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 使用 HashMap 存储映射，每个实例只在一次查询内使用，不会有并发问题
    private final Map<String, IntExpr> intVars;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     */
    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.intVars = new HashMap<>();
    }

    /**
     * 获取指定变量名对应的 Z3 整数变量。
     * 如果变量尚未创建，则会创建并缓存。
     * @param name 变量名，例如 x 或 arr.size。
     * @return 对应的 Z3 ArithExpr 变量。
     */
    public ArithExpr getZ3Var(String name) {
        return intVars.computeIfAbsent(name, n -> {
            logger.debug("创建 Z3 整数变量: {}", n);
            return ctx.mkIntConst(n);
        });
    }

    /**
     * 向 Solver 断言环境中已知的事实：
     * 常量 (x == c)、区间 (lo <= x <= hi)，以及数组大小 (arr.size == n)。
     * 只断言已经在本次查询中出现过的变量。
     * @param solver Z3 Solver 实例。
     * @param env 符号环境。
     */
    public void assertEnvironment(Solver solver, SymbolicEnvironment env) {
        for (String name : new ArrayList<>(intVars.keySet())) {
            ArithExpr var = intVars.get(name);
            SymbolicValue value = env.lookup(name);
            Optional<BigInteger> lo = value.lowerBound();
            Optional<BigInteger> hi = value.upperBound();
            lo.ifPresent(v -> {
                solver.add(ctx.mkGe(var, ctx.mkInt(v.toString())));
                logger.debug("断言 Z3 约束: {} >= {}", name, v);
            });
            hi.ifPresent(v -> {
                solver.add(ctx.mkLe(var, ctx.mkInt(v.toString())));
                logger.debug("断言 Z3 约束: {} <= {}", name, v);
            });
            if (name.endsWith(".size")) {
                String array = name.substring(0, name.length() - ".size".length());
                Optional<BigInteger> size = env.arraySize(array);
                if (size.isPresent()) {
                    solver.add(ctx.mkEq(var, ctx.mkInt(size.get().toString())));
                    logger.debug("断言 Z3 约束: {} == {}", name, size.get());
                } else {
                    solver.add(ctx.mkGe(var, ctx.mkInt(0)));
                }
            }
        }
    }
}
