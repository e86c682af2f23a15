package org.reactome.snf;

/**
 * The kind of measurement a Dataset holds for the cohort.
 * @author wug
 *
 */
public enum View {
    PROTEINS("Proteins"),
    MRNA("mRNA"),
    MIRNA("miRNA"),
    PHENOTYPE("Phenotype"),
    SUBTYPES("Subtypes");
    
    private final String label;
    
    private View(String label) {
        this.label = label;
    }
    
    public String getLabel() {
        return label;
    }
    
    /**
     * Molecular views are the ones used to build similarity networks.
     * @return
     */
    public boolean isOmics() {
        return this == PROTEINS || this == MRNA || this == MIRNA;
    }
    
    @Override
    public String toString() {
        return label;
    }

}
