package it.aw.regmetrics.service;

import it.aw.regmetrics.model.DocumentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parsatore dell'XML completo di un titolo eCFR.
 * <p>
 * Converte il DOM in un albero di {@link DocumentNode} ed estrae il testo in due modalità:
 * <ul>
 *   <li>piatta: un'unica stringa con i frammenti di testo in ordine di documento</li>
 *   <li>a sezioni: mappa heading capitolo → testo del capitolo</li>
 * </ul>
 *
 * Un capitolo è un elemento {@code DIV3} con {@code TYPE="CHAPTER"}; il codice è
 * nell'attributo {@code N}, l'heading nel primo figlio {@code HEAD}.
 * Il confronto dei codici capitolo è esatto e case-insensitive.
 * <p>
 * L'estrazione è deterministica: stesso albero e stesso filtro producono
 * sempre la stessa stringa, requisito per la stabilità del checksum.
 */
public class TitleXmlParser {

    private static final Logger log = LoggerFactory.getLogger(TitleXmlParser.class);

    static final String CHAPTER_LABEL = "DIV3";
    static final String CHAPTER_TYPE  = "CHAPTER";
    static final String HEADING_LABEL = "HEAD";

    /** Errori e errori fatali diventano eccezioni, senza stampa su stderr. */
    private static final ErrorHandler STRICT_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException e) {
            log.debug("TitleXmlParser: warning riga {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    };

    private TitleXmlParser() {}

    /**
     * Esegue il parsing dei byte XML.
     *
     * @throws TitleParseException se il contenuto non è XML ben formato
     */
    public static DocumentNode parse(byte[] xml) throws TitleParseException {
        try {
            DocumentBuilder builder = newBuilder();
            org.w3c.dom.Document dom = builder.parse(new ByteArrayInputStream(xml));
            DocumentNode root = toNode(dom.getDocumentElement());
            log.debug("TitleXmlParser: radice <{}> con {} figli", root.label(), root.children().size());
            return root;
        } catch (SAXException | IOException e) {
            throw new TitleParseException("XML non valido: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Configurazione parser XML non supportata", e);
        }
    }

    /**
     * Estrazione piatta.
     *
     * @param root             radice del documento
     * @param chapterFilter    codici capitolo da includere; null o vuoto = tutto il documento
     * @return frammenti di testo separati da un singolo spazio, "" se non c'è testo
     */
    public static String extractText(DocumentNode root, Collection<String> chapterFilter) {
        Set<String> codes = normalize(chapterFilter);
        if (codes == null) {
            return collectText(root);
        }
        List<String> blocks = new ArrayList<>();
        for (DocumentNode chapter : findChapters(root)) {
            if (codes.contains(chapterCode(chapter))) {
                String text = collectText(chapter);
                if (!text.isEmpty()) blocks.add(text);
            }
        }
        return String.join(" ", blocks);
    }

    /**
     * Estrazione a sezioni: una voce per ogni capitolo che soddisfa il filtro
     * (tutti i capitoli se il filtro è null o vuoto). La chiave è il testo
     * dell'heading, oppure {@code "Chapter <CODICE>"} se l'heading manca.
     */
    public static Map<String, String> extractSections(DocumentNode root, Collection<String> chapterFilter) {
        Set<String> codes = normalize(chapterFilter);
        Map<String, String> sections = new LinkedHashMap<>();
        for (DocumentNode chapter : findChapters(root)) {
            String code = chapterCode(chapter);
            if (codes != null && !codes.contains(code)) continue;
            sections.put(headingOf(chapter, code), collectText(chapter));
        }
        return sections;
    }

    /** Tutti i nodi capitolo del documento, in ordine di documento. */
    public static List<DocumentNode> findChapters(DocumentNode root) {
        List<DocumentNode> chapters = new ArrayList<>();
        root.walk(node -> {
            if (CHAPTER_LABEL.equals(node.label()) && CHAPTER_TYPE.equals(node.attribute("TYPE"))) {
                chapters.add(node);
            }
        });
        return chapters;
    }

    // -------------------------------------------------------------------------

    private static String collectText(DocumentNode scope) {
        List<String> blocks = new ArrayList<>();
        scope.walk(node -> {
            if (node.text() != null) {
                String stripped = MetricsCalculator.strip(node.text());
                if (!stripped.isEmpty()) blocks.add(stripped);
            }
        });
        return String.join(" ", blocks);
    }

    private static String chapterCode(DocumentNode chapter) {
        String n = chapter.attribute("N");
        return n == null ? "" : n.toUpperCase(Locale.ROOT);
    }

    private static String headingOf(DocumentNode chapter, String code) {
        DocumentNode head = chapter.firstChild(HEADING_LABEL);
        String heading = head == null ? "" : MetricsCalculator.strip(head.text());
        if (!heading.isEmpty()) {
            return heading;
        }
        return "Chapter " + code;
    }

    /** Null se il filtro non restringe nulla; altrimenti i codici in maiuscolo. */
    private static Set<String> normalize(Collection<String> chapterFilter) {
        if (chapterFilter == null || chapterFilter.isEmpty()) return null;
        return chapterFilter.stream()
                .filter(c -> c != null && !c.isEmpty())
                .map(c -> c.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private static DocumentNode toNode(Element element) {
        Map<String, String> attributes = new HashMap<>();
        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node attr = attrs.item(i);
            attributes.put(attr.getNodeName(), attr.getNodeValue());
        }

        // Testo iniziale: i nodi testo/CDATA che precedono il primo elemento figlio
        StringBuilder leading = null;
        boolean seenElement = false;
        List<DocumentNode> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node child = nodes.item(i);
            short type = child.getNodeType();
            if (type == Node.ELEMENT_NODE) {
                seenElement = true;
                children.add(toNode((Element) child));
            } else if (!seenElement && (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE)) {
                if (leading == null) leading = new StringBuilder();
                leading.append(child.getNodeValue());
            }
        }
        return new DocumentNode(element.getTagName(), attributes,
                leading == null ? null : leading.toString(), children);
    }

    private static DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setExpandEntityReferences(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(STRICT_ERRORS);
        return builder;
    }
}
