package info.isaksson.erland.scltoxml.emitter;

import info.isaksson.erland.scltoxml.ir.code.CallKind;
import info.isaksson.erland.scltoxml.ir.code.CallParameter;
import info.isaksson.erland.scltoxml.ir.code.CodeToken;
import info.isaksson.erland.scltoxml.ir.code.Component;
import info.isaksson.erland.scltoxml.ir.xml.OpennessXml;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Encodes token lines as a {@code StructuredText} node tree.
 *
 * <p>Every element created here takes the next {@code UId}, parents before children, so identities
 * increase in document order. Lines are separated by {@code NewLine} nodes; a line break inside a
 * statement becomes a {@code NewLine} nested where it occurs.</p>
 */
final class StructuredTextXmlBuilder {

    private final NodeIdCounter uids;
    private final Map<String, String> instanceTypes;

    /**
     * @param instanceTypes lower-case local member name to declared datatype; names the block type of
     *                      {@code #instance(...)} calls
     */
    StructuredTextXmlBuilder(NodeIdCounter uids, Map<String, String> instanceTypes) {
        if (uids == null) throw new IllegalArgumentException("uids must not be null");
        this.uids = uids;
        this.instanceTypes = instanceTypes == null ? Map.of() : instanceTypes;
    }

    Element build(Element networkSource, List<List<CodeToken>> lines) {
        Element st = OpennessXml.append(networkSource, "StructuredText");
        st.setAttribute("xmlns", OpennessXml.STRUCTURED_TEXT_NS);
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) node(st, "NewLine");
            appendAll(st, lines.get(i));
        }
        return st;
    }

    private void appendAll(Element parent, List<CodeToken> tokens) {
        for (CodeToken t : tokens) {
            appendToken(parent, t);
        }
    }

    private void appendToken(Element parent, CodeToken t) {
        switch (t.kind) {
            case WHITESPACE -> {
                Element blank = node(parent, "Blank");
                if (t.count > 1) blank.setAttribute("Num", Integer.toString(t.count));
            }
            case OPERATOR, KEYWORD, IDENTIFIER -> token(parent, t.text);
            case LITERAL_CONSTANT -> constantValue(parent, "LiteralConstant", t.text);
            case TYPED_CONSTANT -> constantValue(parent, "TypedConstant", t.text);
            case ACCESS -> appendAccess(parent, t);
            case CALL -> appendCall(parent, t);
            case LINE_COMMENT -> {
                Element comment = node(parent, "LineComment");
                node(comment, "Text").setTextContent(t.text);
            }
            case TEXT -> {
                if (t.isLineBreak()) {
                    node(parent, "NewLine");
                } else {
                    node(parent, "Text").setTextContent(t.text);
                }
            }
        }
    }

    private void constantValue(Element parent, String scope, String value) {
        Element access = node(parent, "Access");
        access.setAttribute("Scope", scope);
        Element constant = node(access, "Constant");
        node(constant, "ConstantValue").setTextContent(value);
    }

    private void appendAccess(Element parent, CodeToken t) {
        Element access = node(parent, "Access");
        access.setAttribute("Scope", t.scope.xmlName());
        if (t.scope.isConstant() && t.path.size() == 1 && !t.path.get(0).isIndexed()) {
            node(access, "Constant").setAttribute("Name", t.path.get(0).name);
            return;
        }
        appendSymbol(access, t.path);
    }

    private void appendSymbol(Element parent, List<Component> path) {
        Element symbol = node(parent, "Symbol");
        for (int i = 0; i < path.size(); i++) {
            if (i > 0) token(symbol, ".");
            Component c = path.get(i);
            Element component = node(symbol, "Component");
            component.setAttribute("Name", c.name);
            if (c.isIndexed()) {
                component.setAttribute("AccessModifier", "Array");
                token(component, "[");
                appendAll(component, c.index);
                token(component, "]");
            }
        }
    }

    private void appendCall(Element parent, CodeToken t) {
        Element access = node(parent, "Access");
        access.setAttribute("Scope", "Call");
        Element info = node(access, "CallInfo");
        info.setAttribute("Name", callInfoName(t));
        info.setAttribute("BlockType", t.callKind.blockType());

        if (t.callKind != CallKind.INSTRUCTION && (t.callKind == CallKind.INSTANCE || isCompound(t.callee))) {
            Element instance = node(info, "Instance");
            instance.setAttribute("Scope", t.callee.scope.xmlName());
            appendSymbol(instance, t.callee.path);
        }

        token(info, "(");
        for (int i = 0; i < t.parameters.size(); i++) {
            if (i > 0) token(info, ",");
            CallParameter p = t.parameters.get(i);
            appendAll(info, p.leading);
            Element param = node(info, "Parameter");
            if (p.isNamed()) param.setAttribute("Name", p.name);
            appendAll(param, p.value);
        }
        token(info, ")");
    }

    private String callInfoName(CodeToken call) {
        if (call.callKind != CallKind.INSTANCE) return call.calleeName();
        String declared = instanceTypes.get(call.calleeName().toLowerCase(Locale.ROOT));
        if (declared == null || call.callee.path.size() > 1) return call.calleeName();
        return declared.startsWith("\"") && declared.endsWith("\"") && declared.length() > 1
                ? declared.substring(1, declared.length() - 1)
                : declared;
    }

    private static boolean isCompound(CodeToken access) {
        return access.path.size() > 1 || access.path.get(0).isIndexed();
    }

    private void token(Element parent, String text) {
        node(parent, "Token").setAttribute("Text", text);
    }

    private Element node(Element parent, String name) {
        Element e = OpennessXml.append(parent, name);
        e.setAttribute("UId", uids.next());
        return e;
    }
}
