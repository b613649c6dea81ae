package work.lcod.derivation.render;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.derivation.state.ResourceSpace;
import work.lcod.derivation.syntax.SyntacticObject;

/**
 * Converts syntactic objects into plain maps and lists ready for JSON serialization.
 */
public final class TreeView {
    private TreeView() {}

    public static Map<String, Object> toMap(SyntacticObject so) {
        var map = new LinkedHashMap<String, Object>();
        if (so instanceof SyntacticObject.Terminal terminal) {
            map.put("terminal", terminal.text());
        } else if (so instanceof SyntacticObject.Unary unary) {
            map.put("unary", toMap(unary.child()));
        } else if (so instanceof SyntacticObject.Binary binary) {
            map.put("binary", List.of(toMap(binary.left()), toMap(binary.right())));
        }
        return map;
    }

    public static List<String> brackets(ResourceSpace resources) {
        var out = new ArrayList<String>(resources.size());
        for (var so : resources) {
            out.add(Bracket.render(so));
        }
        return out;
    }
}
