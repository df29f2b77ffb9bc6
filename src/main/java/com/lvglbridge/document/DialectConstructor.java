/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: DialectConstructor.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Safe constructor used to lift document nodes into native values
 *      (action blocks). ESPHome files are full of application tags such as
 *      !lambda and !secret; instead of failing on them, scalars keep their tag
 *      as TaggedScalar and collections are built as plain maps/lists.
 * =============================================================================
 */
package com.lvglbridge.document;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

final class DialectConstructor extends SafeConstructor {

    DialectConstructor(LoaderOptions options) {
        super(options);
        this.yamlConstructors.put(null, new ConstructApplicationTag());
    }

    Object toNative(Node node) {
        return constructDocument(node);
    }

    private final class ConstructApplicationTag extends AbstractConstruct {
        @Override
        public Object construct(Node node) {
            if (node instanceof ScalarNode scalar) {
                return new TaggedScalar(node.getTag().getValue(), scalar.getValue());
            } else if (node instanceof MappingNode) {
                return yamlConstructors.get(Tag.MAP).construct(node);
            } else if (node instanceof SequenceNode) {
                return yamlConstructors.get(Tag.SEQ).construct(node);
            }
            throw new IllegalStateException("Unexpected node kind: " + node.getNodeId());
        }
    }
}
