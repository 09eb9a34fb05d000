package com.flamingo.ai.entities.service.symbols.parser;

import com.flamingo.ai.entities.service.symbols.model.ParsedSymbol;
import com.flamingo.ai.entities.service.symbols.model.Token;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * {@link SymbolForestExtractor} for the annotated MathML printed by the KaTeX equation parser.
 *
 * <p>Token elements ({@code mi}, {@code mn}, {@code mo}, {@code mtext}) carry their offsets in the
 * equation TeX as {@code s2:start}, {@code s2:end} and, optionally, {@code s2:index} attributes.
 * Token elements without offsets are not tokens.
 *
 * <p>Symbols are:
 *
 * <ul>
 *   <li>identifiers ({@code mi})
 *   <li>scripted symbols ({@code msub}, {@code msup}, {@code msubsup}) whose base is a symbol
 * </ul>
 *
 * A symbol's children are the nearest symbols inside it, and its tokens are all tokens inside it.
 * A symbol marked {@code s2:is-definition="true"} is a definition.
 */
@Component
@Slf4j
public class MathMlSymbolForestExtractor implements SymbolForestExtractor {

  private static final Set<String> TOKEN_ELEMENTS = Set.of("mi", "mn", "mo", "mtext");
  private static final Set<String> SCRIPT_ELEMENTS = Set.of("msub", "msup", "msubsup");

  private static final String START_ATTRIBUTE = "s2:start";
  private static final String END_ATTRIBUTE = "s2:end";
  private static final String INDEX_ATTRIBUTE = "s2:index";
  private static final String DEFINITION_ATTRIBUTE = "s2:is-definition";

  @Override
  public List<ParsedSymbol> extract(String mathMl) {
    Element root = parse(mathMl).getDocumentElement();

    Map<Element, Token> tokens = indexTokens(root);

    // Built in reverse document order so a symbol's children exist before it does.
    Map<Element, ParsedSymbol> symbols = new HashMap<>();
    List<Element> symbolElements = new ArrayList<>();
    collectSymbolElements(root, symbolElements);
    for (int i = symbolElements.size() - 1; i >= 0; i--) {
      Element element = symbolElements.get(i);
      symbols.put(element, toSymbol(element, tokens, symbols));
    }

    List<ParsedSymbol> forest = new ArrayList<>(symbolElements.size());
    for (Element element : symbolElements) {
      forest.add(symbols.get(element));
    }
    return forest;
  }

  private Document parse(String mathMl) {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      DocumentBuilder builder = factory.newDocumentBuilder();
      return builder.parse(new InputSource(new StringReader(mathMl)));
    } catch (ParserConfigurationException | SAXException | IOException e) {
      throw new IllegalArgumentException("Unreadable MathML: " + e.getMessage(), e);
    }
  }

  private Map<Element, Token> indexTokens(Element root) {
    List<Element> tokenElements = new ArrayList<>();
    collectTokenElements(root, tokenElements);

    // Tokens without an index are numbered after the largest explicit one, in document order.
    int nextIndex = 0;
    for (Element element : tokenElements) {
      if (element.hasAttribute(INDEX_ATTRIBUTE)) {
        nextIndex = Math.max(nextIndex, explicitIndex(element) + 1);
      }
    }

    Map<Element, Token> tokens = new HashMap<>();
    for (Element element : tokenElements) {
      int index = element.hasAttribute(INDEX_ATTRIBUTE) ? explicitIndex(element) : nextIndex++;
      tokens.put(
          element,
          new Token(
              index,
              Integer.parseInt(element.getAttribute(START_ATTRIBUTE)),
              Integer.parseInt(element.getAttribute(END_ATTRIBUTE)),
              element.getTextContent()));
    }
    return tokens;
  }

  private static int explicitIndex(Element element) {
    return Integer.parseInt(element.getAttribute(INDEX_ATTRIBUTE));
  }

  private void collectTokenElements(Element element, List<Element> tokenElements) {
    if (TOKEN_ELEMENTS.contains(element.getTagName())
        && element.hasAttribute(START_ATTRIBUTE)
        && element.hasAttribute(END_ATTRIBUTE)) {
      tokenElements.add(element);
    }
    for (Element child : childElements(element)) {
      collectTokenElements(child, tokenElements);
    }
  }

  private void collectSymbolElements(Element element, List<Element> symbolElements) {
    if (isSymbol(element)) {
      symbolElements.add(element);
    }
    for (Element child : childElements(element)) {
      collectSymbolElements(child, symbolElements);
    }
  }

  private boolean isSymbol(Element element) {
    String name = element.getTagName();
    if ("mi".equals(name)) {
      return true;
    }
    if (SCRIPT_ELEMENTS.contains(name)) {
      List<Element> children = childElements(element);
      return !children.isEmpty() && isSymbol(children.get(0));
    }
    return false;
  }

  private ParsedSymbol toSymbol(
      Element element, Map<Element, Token> tokens, Map<Element, ParsedSymbol> builtSymbols) {
    List<Token> covered = new ArrayList<>();
    collectCoveredTokens(element, tokens, covered);

    List<ParsedSymbol> children = new ArrayList<>();
    for (Element child : childElements(element)) {
      collectNearestSymbols(child, builtSymbols, children);
    }

    return new ParsedSymbol(
        serialize(element),
        "true".equals(element.getAttribute(DEFINITION_ATTRIBUTE)),
        List.copyOf(covered),
        List.copyOf(children));
  }

  private void collectCoveredTokens(
      Element element, Map<Element, Token> tokens, List<Token> covered) {
    Token token = tokens.get(element);
    if (token != null) {
      covered.add(token);
    }
    for (Element child : childElements(element)) {
      collectCoveredTokens(child, tokens, covered);
    }
  }

  private void collectNearestSymbols(
      Element element, Map<Element, ParsedSymbol> builtSymbols, List<ParsedSymbol> nearest) {
    ParsedSymbol symbol = builtSymbols.get(element);
    if (symbol != null) {
      nearest.add(symbol);
      return;
    }
    for (Element child : childElements(element)) {
      collectNearestSymbols(child, builtSymbols, nearest);
    }
  }

  private List<Element> childElements(Element element) {
    NodeList nodes = element.getChildNodes();
    List<Element> children = new ArrayList<>(nodes.getLength());
    for (int i = 0; i < nodes.getLength(); i++) {
      Node node = nodes.item(i);
      if (node.getNodeType() == Node.ELEMENT_NODE) {
        children.add((Element) node);
      }
    }
    return children;
  }

  private String serialize(Element element) {
    try {
      Transformer transformer = TransformerFactory.newInstance().newTransformer();
      transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
      StringWriter out = new StringWriter();
      transformer.transform(new DOMSource(element), new StreamResult(out));
      return out.toString();
    } catch (TransformerException e) {
      log.warn("Could not serialize MathML element <{}>: {}", element.getTagName(), e.getMessage());
      return "";
    }
  }
}
