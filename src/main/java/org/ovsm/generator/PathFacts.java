package org.ovsm.generator;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 当前控制流路径上已经建立的账户事实。
 * 分支开始时复制，分支汇合时用 {@link #join(PathFacts)} 合并：
 * 已验证事实取交集 (两条路径都验证过才算)，已关闭账户取并集 (任一路径关闭即视为可能已关闭)。
 */
public final class PathFacts {

    private final Set<BigInteger> verifiedSigners;
    private final Set<BigInteger> verifiedWritable;
    private final Set<BigInteger> verifiedOwners;
    private final Set<BigInteger> closedAccounts;
    private final Set<String> verifiedSysvars;
    private final Set<String> initializedVars;
    private boolean lockHeld;

    public PathFacts() {
        this.verifiedSigners = new HashSet<>();
        this.verifiedWritable = new HashSet<>();
        this.verifiedOwners = new HashSet<>();
        this.closedAccounts = new HashSet<>();
        this.verifiedSysvars = new HashSet<>();
        this.initializedVars = new HashSet<>();
        this.lockHeld = false;
    }

    private PathFacts(PathFacts other) {
        this.verifiedSigners = new HashSet<>(other.verifiedSigners);
        this.verifiedWritable = new HashSet<>(other.verifiedWritable);
        this.verifiedOwners = new HashSet<>(other.verifiedOwners);
        this.closedAccounts = new HashSet<>(other.closedAccounts);
        this.verifiedSysvars = new HashSet<>(other.verifiedSysvars);
        this.initializedVars = new HashSet<>(other.initializedVars);
        this.lockHeld = other.lockHeld;
    }

    public PathFacts copy() {
        return new PathFacts(this);
    }

    /**
     * 两条路径汇合后的事实。
     */
    public PathFacts join(PathFacts other) {
        PathFacts joined = copy();
        joined.verifiedSigners.retainAll(other.verifiedSigners);
        joined.verifiedWritable.retainAll(other.verifiedWritable);
        joined.verifiedOwners.retainAll(other.verifiedOwners);
        joined.verifiedSysvars.retainAll(other.verifiedSysvars);
        joined.initializedVars.retainAll(other.initializedVars);
        joined.closedAccounts.addAll(other.closedAccounts);
        joined.lockHeld = lockHeld && other.lockHeld;
        return joined;
    }

    public void markSigner(BigInteger account) {
        verifiedSigners.add(account);
    }

    public boolean isSigner(BigInteger account) {
        return verifiedSigners.contains(account);
    }

    public void markWritable(BigInteger account) {
        verifiedWritable.add(account);
    }

    public boolean isWritable(BigInteger account) {
        return verifiedWritable.contains(account);
    }

    public void markOwner(BigInteger account) {
        verifiedOwners.add(account);
    }

    public boolean isOwner(BigInteger account) {
        return verifiedOwners.contains(account);
    }

    /**
     * 标记账户已关闭。
     * @return 此前是否已经 (可能) 被关闭过
     */
    public boolean markClosed(BigInteger account) {
        return !closedAccounts.add(account);
    }

    public boolean isClosed(BigInteger account) {
        return closedAccounts.contains(account);
    }

    /**
     * 在 earlier 之后才被关闭的账户，按编号排序。
     */
    public List<BigInteger> closedSince(PathFacts earlier) {
        List<BigInteger> accounts = new ArrayList<>();
        for (BigInteger account : closedAccounts) {
            if (!earlier.closedAccounts.contains(account)) {
                accounts.add(account);
            }
        }
        Collections.sort(accounts);
        return accounts;
    }

    public void markSysvar(String sysvar) {
        verifiedSysvars.add(sysvar);
    }

    public boolean isSysvarVerified(String sysvar) {
        return verifiedSysvars.contains(sysvar);
    }

    public void markInitialized(String variable) {
        initializedVars.add(variable);
    }

    public boolean isInitialized(String variable) {
        return initializedVars.contains(variable);
    }

    public void setLockHeld(boolean held) {
        this.lockHeld = held;
    }

    public boolean isLockHeld() {
        return lockHeld;
    }

    @Override
    public String toString() {
        return "PathFacts{signers=" + verifiedSigners + ", writable=" + verifiedWritable
                + ", owners=" + verifiedOwners + ", closed=" + closedAccounts
                + ", sysvars=" + verifiedSysvars + ", lock=" + lockHeld + "}";
    }
}
