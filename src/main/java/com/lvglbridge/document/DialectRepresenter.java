/*
 * =============================================================================
 *  LvglBridge Display Configuration Toolkit
 *  File: DialectRepresenter.java
 * -----------------------------------------------------------------------------
 *  Purpose:
 *      Turns native values into document nodes for insertion.
 *      - HexLiteral   -> plain !!int scalar (0x007ACC, never quoted)
 *      - TaggedScalar -> scalar with its original tag (!lambda, !secret)
 *      - everything else -> SnakeYAML defaults, block style
 * =============================================================================
 */
package com.lvglbridge.document;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

final class DialectRepresenter extends Representer {

    DialectRepresenter(DumperOptions options) {
        super(options);
        this.representers.put(HexLiteral.class, data -> representScalar(Tag.INT, ((HexLiteral) data).text()));
        this.representers.put(TaggedScalar.class, data -> {
            TaggedScalar ts = (TaggedScalar) data;
            DumperOptions.ScalarStyle style = ts.value().contains("\n")
                    ? DumperOptions.ScalarStyle.LITERAL
                    : DumperOptions.ScalarStyle.PLAIN;
            return representScalar(new Tag(ts.tag()), ts.value(), style);
        });
    }
}
