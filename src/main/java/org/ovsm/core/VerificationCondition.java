package org.ovsm.core;

import lombok.Getter;
import org.ovsm.expressions.Formula;

import java.util.List;
import java.util.Objects;

/**
 * 一条证明义务。生成后不再修改，证明结果另存于 {@link ProofResult}。
 * @author Ayalyt
 */
@Getter
public final class VerificationCondition {

    private final String id;
    private final VCCategory category;
    // 仅 CUSTOM 类别使用
    private final String customName;
    private final String description;
    // 可能为 null
    private final SourceLocation location;
    private final Formula property;
    private final List<Formula> assumptions;
    private final String tactic;

    private VerificationCondition(String id, VCCategory category, String customName, String description,
                                  SourceLocation location, Formula property, List<Formula> assumptions,
                                  String tactic) {
        this.id = Objects.requireNonNull(id, "VC id cannot be null");
        this.category = Objects.requireNonNull(category, "VC category cannot be null");
        if (category == VCCategory.CUSTOM && (customName == null || customName.isEmpty())) {
            throw new IllegalArgumentException("Custom category requires a name");
        }
        this.customName = category == VCCategory.CUSTOM ? customName : null;
        this.description = Objects.requireNonNull(description, "VC description cannot be null");
        this.location = location;
        this.property = Objects.requireNonNull(property, "VC property cannot be null");
        this.assumptions = List.copyOf(Objects.requireNonNull(assumptions, "VC assumptions cannot be null"));
        this.tactic = Objects.requireNonNull(tactic, "VC tactic cannot be null");
    }

    /**
     * 工厂方法：创建固定类别的验证条件。
     */
    public static VerificationCondition of(String id, VCCategory category, String description,
                                           SourceLocation location, Formula property,
                                           List<Formula> assumptions, String tactic) {
        return new VerificationCondition(id, category, null, description, location, property, assumptions, tactic);
    }

    /**
     * 工厂方法：创建自定义类别 (custom_name) 的验证条件。
     */
    public static VerificationCondition custom(String id, String customName, String description,
                                               SourceLocation location, Formula property,
                                               List<Formula> assumptions, String tactic) {
        return new VerificationCondition(id, VCCategory.CUSTOM, customName, description, location, property,
                assumptions, tactic);
    }

    /**
     * 类别的显示名，自定义类别为 custom_name。
     */
    public String getCategoryName() {
        return displayName(category, customName);
    }

    public static String displayName(VCCategory category, String customName) {
        return category == VCCategory.CUSTOM ? "custom_" + customName : category.getDisplayName();
    }

    public boolean isCustom(String name) {
        return category == VCCategory.CUSTOM && customName.equals(name);
    }

    /**
     * 待证性质的文本形式。
     */
    public String getPropertyText() {
        return property.renderBare();
    }

    public List<String> getAssumptionTexts() {
        return assumptions.stream().map(Formula::render).toList();
    }

    public int getLine() {
        return location == null ? 1 : location.getLine();
    }

    @Override
    public String toString() {
        return id + " [" + getCategoryName() + "] " + getPropertyText();
    }
}
