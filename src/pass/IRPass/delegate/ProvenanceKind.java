package pass.IRPass.delegate;

/**
 * 基址的分类，按 {@link pass.IRPass.analysis.ProvenanceAnalysis#classify} 的判定顺序排列。
 */
public enum ProvenanceKind {
    /* addrspace(100) 的指针，内存属于某个具体节点 */
    GLOBAL_REMOTE,
    /* addrspace(200)，每个节点都有一份副本 */
    SYMMETRIC,
    /* 模块级全局变量 */
    STATIC,
    CONSTANT,
    /* alloca 或形参 */
    STACK,
    UNKNOWN;

    /* 能作为区域种子的基址 */
    public boolean isAnchor() {
        return this == GLOBAL_REMOTE || this == STACK;
    }

    /* 在任何节点上访问都等价，不影响区域合法性 */
    public boolean isLocationAgnostic() {
        return this == SYMMETRIC || this == STATIC || this == CONSTANT;
    }
}
