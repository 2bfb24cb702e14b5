package tailcall.truffle.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * 通用递归下降。
 *
 * 每个节点类型只声明“子节点是什么、如何重建”；各个变换阶段只提供“对子节点做什么”，
 * 递归方式统一在这里实现一次。
 */
public final class Walk {

  private Walk() {}

  /**
   * 按固定顺序变换每个子节点，并把结果交给重建函数。
   * 重建函数可以产生不同种类的节点（例如把平凡条件重建为已转换条件）。
   *
   * @param node 当前节点
   * @param transform 子节点变换
   * @param rebuild 重建函数，参数为按原顺序排列的变换结果
   * @return 重建结果
   */
  public static <R> R fold(Expr node, UnaryOperator<Expr> transform, Function<List<Expr>, R> rebuild) {
    return foldIndexed(node, (position, child) -> transform.apply(child), rebuild);
  }

  /**
   * 与 {@link #fold} 相同，但变换函数同时拿到子节点的位置，供只处理部分位置的阶段使用
   * （例如条件的测试、调用的续延实参）。
   */
  public static <R> R foldIndexed(Expr node, PositionalTransform transform, Function<List<Expr>, R> rebuild) {
    List<Expr> children = node.children();
    List<Expr> transformed = new ArrayList<>(children.size());
    for (int i = 0; i < children.size(); i++) {
      transformed.add(transform.apply(i, children.get(i)));
    }
    return rebuild.apply(List.copyOf(transformed));
  }

  /**
   * 按位置变换子节点并重建同类节点。
   */
  public static Expr mapIndexed(Expr node, PositionalTransform transform) {
    if (node.children().isEmpty()) {
      return node;
    }
    return foldIndexed(node, transform, node::withChildren);
  }

  /** 带位置的子节点变换；位置即 {@link Expr#children()} 中的下标 */
  @FunctionalInterface
  public interface PositionalTransform {
    Expr apply(int position, Expr child);
  }

  /**
   * 变换所有子节点并重建同类节点。
   */
  public static Expr map(Expr node, UnaryOperator<Expr> transform) {
    if (node.children().isEmpty()) {
      return node;
    }
    return fold(node, transform, node::withChildren);
  }

  /**
   * 自底向上改写：先改写子树，再对重建后的节点应用 {@code rewrite}。
   */
  public static Expr bottomUp(Expr node, UnaryOperator<Expr> rewrite) {
    return rewrite.apply(map(node, child -> bottomUp(child, rewrite)));
  }

  /**
   * 判断子树中是否存在满足条件的节点（包括根节点）。
   */
  public static boolean anyMatch(Expr node, Predicate<Expr> predicate) {
    if (predicate.test(node)) {
      return true;
    }
    for (Expr child : node.children()) {
      if (anyMatch(child, predicate)) {
        return true;
      }
    }
    return false;
  }

  /**
   * 统计子树中满足条件的节点数量（包括根节点）。
   */
  public static int count(Expr node, Predicate<Expr> predicate) {
    int total = predicate.test(node) ? 1 : 0;
    for (Expr child : node.children()) {
      total += count(child, predicate);
    }
    return total;
  }
}
