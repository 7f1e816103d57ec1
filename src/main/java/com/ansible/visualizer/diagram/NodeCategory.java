package com.ansible.visualizer.diagram;

/**
 * Node categories of the diagram, in class-assignment order, with their Mermaid style class.
 */
public enum NodeCategory {
    GROUP("groupClass", "fill:#e1f5fe,stroke:#01579b,stroke-width:2px"),
    HOST("hostClass", "fill:#fff3e0,stroke:#e65100,stroke-width:1px"),
    PLAYBOOK("playbookClass", "fill:#e8f5e9,stroke:#1b5e20,stroke-width:3px"),
    ROLE("roleClass", "fill:#f3e5f5,stroke:#4a148c,stroke-width:2px"),
    TASK("taskClass", "fill:#fafafa,stroke:#616161,stroke-width:1px"),
    HANDLER("handlerClass", "fill:#fff8e1,stroke:#ff6f00,stroke-width:1px,stroke-dasharray: 5 5"),
    INCLUDE("includeClass", "fill:#e0f2f1,stroke:#00695c,stroke-width:1px"),
    TAG("tagClass", "fill:#e8eaf6,stroke:#283593,stroke-width:1px,stroke-dasharray: 3 3"),
    BECOME("becomeClass", "fill:#fce4ec,stroke:#b71c1c,stroke-width:1px,stroke-dasharray: 3 3");

    private final String styleClass;
    private final String style;

    NodeCategory(String styleClass, String style) {
        this.styleClass = styleClass;
        this.style = style;
    }

    public String getStyleClass() {
        return styleClass;
    }

    public String classDefinition() {
        return "classDef " + styleClass + " " + style;
    }
}
