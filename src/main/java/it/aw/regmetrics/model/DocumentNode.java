package it.aw.regmetrics.model;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Nodo dell'albero di un documento XML già parsato.
 * <p>
 * {@code text} contiene solo il testo che precede il primo figlio (null se assente);
 * i figli sono mantenuti nell'ordine del documento. Il nodo è immutabile.
 */
public record DocumentNode(
        String                 label,       // nome dell'elemento (es. "DIV3", "HEAD", "P")
        Map<String, String>    attributes,  // attributi dell'elemento
        String                 text,        // testo iniziale, null se assente
        List<DocumentNode>     children     // figli in ordine di documento
) {

    public DocumentNode {
        attributes = Map.copyOf(attributes);
        children = List.copyOf(children);
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    /** Primo figlio diretto con l'etichetta data, oppure null. */
    public DocumentNode firstChild(String childLabel) {
        for (DocumentNode child : children) {
            if (child.label().equals(childLabel)) return child;
        }
        return null;
    }

    /**
     * Visita in pre-ordine: il nodo stesso e poi tutti i discendenti,
     * nello stesso ordine in cui compaiono nel documento.
     */
    public void walk(Consumer<DocumentNode> visitor) {
        visitor.accept(this);
        for (DocumentNode child : children) {
            child.walk(visitor);
        }
    }
}
