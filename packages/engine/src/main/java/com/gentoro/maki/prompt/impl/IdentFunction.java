package com.gentoro.maki.prompt.impl;

import com.gentoro.maki.utility.StringUtility;
import io.pebbletemplates.pebble.extension.Function;
import io.pebbletemplates.pebble.template.EvaluationContext;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.util.List;
import java.util.Map;

/** {@code ident(text, n)}: indents every line of a multi-line value by n spaces. */
public class IdentFunction implements Function {

  @Override
  public List<String> getArgumentNames() {
    // positional arguments
    return null;
  }

  @Override
  public Object execute(
      Map<String, Object> args, PebbleTemplate self, EvaluationContext context, int lineNumber) {
    Object indent = args.get("1");
    int n = indent instanceof Number num ? num.intValue() : 0;
    return StringUtility.formatWithIndent(String.valueOf(args.get("0")), n, -1);
  }
}
