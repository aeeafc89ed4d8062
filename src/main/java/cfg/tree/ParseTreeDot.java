package cfg.tree;

import java.io.File;
import java.io.IOException;

import guru.nidi.graphviz.attribute.Label;
import guru.nidi.graphviz.attribute.Shape;
import guru.nidi.graphviz.engine.Format;
import guru.nidi.graphviz.engine.Graphviz;
import guru.nidi.graphviz.model.MutableGraph;
import guru.nidi.graphviz.model.MutableNode;

import static guru.nidi.graphviz.model.Factory.mutGraph;
import static guru.nidi.graphviz.model.Factory.mutNode;

/**
 * Converts parse tree skeletons into graphviz graphs: non terminals are ellipses, terminals boxes.
 */
public class ParseTreeDot {

	public static MutableGraph toGraph(ParseTreeNode tree, String name){
		MutableGraph graph = mutGraph(name).setDirected(true);
		graph.add(toNode(tree));
		return graph;
	}

	private static MutableNode toNode(ParseTreeNode tree){
		MutableNode node = mutNode(tree.id).add(Label.of(tree.label), tree.terminal ? Shape.BOX : Shape.ELLIPSE);
		for (ParseTreeNode child : tree.children){
			node.addLink(toNode(child));
		}
		return node;
	}

	/**
	 * @return the tree in the dot language
	 */
	public static String toDot(ParseTreeNode tree, String name){
		return toGraph(tree, name).toString();
	}

	/**
	 * Renders the tree with graphviz, needs a graphviz engine (like an installed dot binary)
	 */
	public static void render(ParseTreeNode tree, String name, Format format, File file) throws IOException {
		Graphviz.fromGraph(toGraph(tree, name)).render(format).toFile(file);
	}
}
