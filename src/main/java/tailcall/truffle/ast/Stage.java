package tailcall.truffle.ast;

/**
 * 节点所属的变换阶段标签。
 *
 * <ul>
 *   <li>{@link #SHARED}：各阶段通用的节点（字面量、变量、运算、函数、调用、定义、程序）</li>
 *   <li>{@link #SURFACE}：仅出现在源树中的节点（未转换的条件分支）</li>
 *   <li>{@link #CPS}：CPS 转换引入的节点（续延、续延调用、已转换条件）</li>
 *   <li>{@link #TARGET}：蹦床插入阶段引入的节点</li>
 * </ul>
 */
public enum Stage {
  SHARED,
  SURFACE,
  CPS,
  TARGET
}
