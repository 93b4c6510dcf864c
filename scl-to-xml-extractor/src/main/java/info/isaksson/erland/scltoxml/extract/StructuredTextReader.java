package info.isaksson.erland.scltoxml.extract;

import info.isaksson.erland.scltoxml.ir.ConversionWarnings;
import info.isaksson.erland.scltoxml.ir.code.AccessScope;
import info.isaksson.erland.scltoxml.ir.code.CallKind;
import info.isaksson.erland.scltoxml.ir.code.CallParameter;
import info.isaksson.erland.scltoxml.ir.code.CodeToken;
import info.isaksson.erland.scltoxml.ir.code.CodeTokenKind;
import info.isaksson.erland.scltoxml.ir.code.Component;
import info.isaksson.erland.scltoxml.ir.code.SclKeywords;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.attribute;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.child;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.children;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.descendant;
import static info.isaksson.erland.scltoxml.ir.xml.OpennessXml.localName;

/**
 * Rebuilds token lines from a {@code StructuredText} node tree.
 *
 * <p>Top-level {@code NewLine} nodes end a line. A {@code NewLine} nested inside a call or an index
 * (a call written over several lines) becomes a line break inside the token stream and is split
 * out by the caller after rendering. Nodes that cannot be read contribute nothing and record a
 * warning.</p>
 */
final class StructuredTextReader {

    static final String LINE_BREAK = CodeToken.LINE_BREAK;

    private final ConversionWarnings warnings;

    StructuredTextReader(ConversionWarnings warnings) {
        this.warnings = warnings;
    }

    List<List<CodeToken>> read(Element structuredText) {
        List<List<CodeToken>> lines = new ArrayList<>();
        List<Element> nodes = children(structuredText);
        List<CodeToken> current = new ArrayList<>();
        for (Element node : nodes) {
            if ("NewLine".equals(localName(node))) {
                for (int i = 0; i < count(node, "Num"); i++) {
                    lines.add(current);
                    current = new ArrayList<>();
                }
                continue;
            }
            appendNode(node, current);
        }
        if (!nodes.isEmpty()) lines.add(current);
        return lines;
    }

    private void appendNode(Element e, List<CodeToken> out) {
        switch (localName(e)) {
            case "Blank" -> out.add(CodeToken.whitespace(count(e, "Num")));
            case "NewLine" -> {
                for (int i = 0; i < count(e, "Num"); i++) out.add(CodeToken.lineBreak());
            }
            case "Token" -> {
                String text = attribute(e, "Text");
                if (text == null || text.isEmpty()) {
                    warnings.incomplete("TOKEN_WITHOUT_TEXT", "Token has no Text attribute", "uid", e.getAttribute("UId"));
                } else {
                    out.add(SclKeywords.classify(text));
                }
            }
            case "Access" -> readAccess(e, out);
            case "LineComment" -> {
                Element text = child(e, "Text");
                out.add(CodeToken.lineComment(text != null ? text.getTextContent() : e.getTextContent()));
            }
            case "Text" -> out.add(CodeToken.text(e.getTextContent()));
            default -> warnings.unsupported("UNKNOWN_ELEMENT", "Structured-text element is not recognized",
                    "element", localName(e));
        }
    }

    private void readAccess(Element e, List<CodeToken> out) {
        String scope = attribute(e, "Scope");
        String uid = e.getAttribute("UId");
        if (scope == null || scope.isBlank()) {
            warnings.incomplete("ACCESS_WITHOUT_SCOPE", "Access node has no Scope", "uid", uid);
            return;
        }
        switch (scope) {
            case "LiteralConstant", "TypedConstant" -> {
                Element value = descendant(e, "ConstantValue");
                if (value == null) {
                    warnings.incomplete("CONSTANT_WITHOUT_VALUE", "Constant has no ConstantValue", "uid", uid);
                    return;
                }
                String text = value.getTextContent();
                out.add(scope.equals("TypedConstant") ? CodeToken.typedLiteral(text) : CodeToken.literal(text));
            }
            case "Call" -> readCall(e, out);
            default -> {
                AccessScope s = AccessScope.fromXmlName(scope);
                if (s == null) {
                    warnings.unsupported("UNKNOWN_SCOPE", "Access scope is not supported", "scope", scope);
                    return;
                }
                CodeToken access = variable(e, s);
                if (access != null) out.add(access);
            }
        }
    }

    /** A {@code Symbol} path, or a named {@code Constant}. */
    private CodeToken variable(Element access, AccessScope scope) {
        Element symbol = child(access, "Symbol");
        if (symbol != null) {
            List<Component> path = readPath(symbol);
            if (!path.isEmpty()) return CodeToken.access(scope, path);
        } else {
            Element constant = child(access, "Constant");
            String name = constant == null ? null : attribute(constant, "Name");
            if (name != null && !name.isEmpty()) return CodeToken.access(scope, name);
        }
        warnings.incomplete("ACCESS_WITHOUT_SYMBOL", "Access node names no symbol or constant",
                "uid", access.getAttribute("UId"));
        return null;
    }

    /** Components of a symbol; {@code Token "."} separators are implied by the path. */
    private List<Component> readPath(Element symbol) {
        List<Component> path = new ArrayList<>();
        for (Element c : children(symbol, "Component")) {
            String name = attribute(c, "Name");
            if (name == null) continue;
            path.add(new Component(name, index(c)));
        }
        return path;
    }

    private List<CodeToken> index(Element component) {
        List<Element> nodes = children(component);
        if (nodes.isEmpty() && !"Array".equals(component.getAttribute("AccessModifier"))) return null;
        List<CodeToken> tokens = new ArrayList<>();
        for (Element n : nodes) appendNode(n, tokens);
        // Bracket tokens are optional in the input; the renderer always writes them.
        if (tokens.size() >= 2 && isOperator(tokens.get(0), "[") && isOperator(tokens.get(tokens.size() - 1), "]")) {
            return tokens.subList(1, tokens.size() - 1);
        }
        return tokens;
    }

    private void readCall(Element access, List<CodeToken> out) {
        Element info = child(access, "CallInfo");
        if (info == null) {
            warnings.incomplete("CALL_WITHOUT_CALLINFO", "Call has no CallInfo", "uid", access.getAttribute("UId"));
            return;
        }
        String name = attribute(info, "Name");
        CallKind kind = CallKind.fromBlockType(attribute(info, "BlockType"));

        CodeToken callee = null;
        Element instance = child(info, "Instance");
        if (instance != null) {
            AccessScope scope = AccessScope.fromXmlName(attribute(instance, "Scope"));
            Element symbol = child(instance, "Symbol");
            List<Component> path = readPath(symbol != null ? symbol : instance);
            if (!path.isEmpty()) {
                callee = CodeToken.access(scope != null ? scope : AccessScope.LOCAL_VARIABLE, path);
            }
        }
        if (callee == null && (name == null || name.isEmpty())) {
            warnings.incomplete("CALL_WITHOUT_NAME", "Call names neither an instance nor a block", "uid",
                    access.getAttribute("UId"));
            return;
        }

        List<CallParameter> params = readParameters(info);
        if (callee != null) {
            out.add(CodeToken.call(callee, params));
        } else if (kind == CallKind.INSTRUCTION) {
            out.add(CodeToken.instructionCall(name, params));
        } else {
            out.add(CodeToken.call(CodeToken.access(AccessScope.GLOBAL_VARIABLE, name), params));
        }
    }

    private List<CallParameter> readParameters(Element info) {
        List<CallParameter> params = new ArrayList<>();
        List<CodeToken> leading = new ArrayList<>();
        for (Element n : children(info)) {
            String local = localName(n);
            if (local.equals("Instance")) continue;
            if (local.equals("Token")) {
                String text = n.getAttribute("Text");
                if (text.equals("(") || text.equals(")") || text.equals(",")) continue;
            }
            if (local.equals("Parameter")) {
                List<CodeToken> value = new ArrayList<>();
                for (Element v : children(n)) appendNode(v, value);
                params.add(new CallParameter(leading, attribute(n, "Name"), value));
                leading = new ArrayList<>();
                continue;
            }
            appendNode(n, leading);
        }
        if (!leading.isEmpty()) {
            if (params.isEmpty()) {
                params.add(new CallParameter(leading, null, null));
            } else {
                CallParameter last = params.remove(params.size() - 1);
                List<CodeToken> value = new ArrayList<>(last.value);
                value.addAll(leading);
                params.add(new CallParameter(last.leading, last.name, value));
            }
        }
        return params;
    }

    private static boolean isOperator(CodeToken t, String text) {
        return t.kind == CodeTokenKind.OPERATOR && text.equals(t.text);
    }

    private static int count(Element e, String attribute) {
        String v = attribute(e, attribute);
        if (v == null) return 1;
        try {
            return Math.max(1, Integer.parseInt(v.trim()));
        } catch (NumberFormatException ex) {
            return 1;
        }
    }
}
