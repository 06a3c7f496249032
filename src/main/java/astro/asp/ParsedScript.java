package astro.asp;

import astro.asp.core.ScriptModel.FunctionRegion;
import astro.asp.core.ScriptModel.Header;
import astro.asp.core.ScriptModel.Stmt;
import astro.asp.render.Renderer;

import java.util.List;
import java.util.Map;

/**
 * 一次解析的结果：头记录、根层级语句树、函数区间索引。
 * 结果归调用方所有，解析器不再持有任何引用。
 */
public final class ParsedScript {
  private final Header header;
  private final List<Stmt> statements;
  private final List<FunctionRegion> functions;
  private final int indentUnit;

  ParsedScript(Header header, List<Stmt> statements, List<FunctionRegion> functions, int indentUnit) {
    this.header = header;
    this.statements = List.copyOf(statements);
    this.functions = List.copyOf(functions);
    this.indentUnit = indentUnit;
  }

  public Header header() { return header; }
  public List<Stmt> statements() { return statements; }
  public List<FunctionRegion> functions() { return functions; }

  /** 文件确定的每级缩进空格数 */
  public int indentUnit() { return indentUnit; }

  /** 解释器读取的代码对象，首元素为头记录 */
  public List<Map<String, Object>> toCodeObject() {
    return Renderer.render(header, statements);
  }

  public String toJson() {
    return Renderer.toJson(header, statements, false);
  }

  public String toPrettyJson() {
    return Renderer.toJson(header, statements, true);
  }
}
