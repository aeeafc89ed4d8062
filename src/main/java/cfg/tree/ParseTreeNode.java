package cfg.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import cfg.grammar.Epsilon;

import static cfg.util.Utils.join;

/**
 * Node of a parse tree skeleton. The id is only unique within the trees of one generator call.
 */
public class ParseTreeNode {

	public final String id;

	public final String label;

	/**
	 * Terminal or epsilon leaf?
	 */
	public final boolean terminal;

	public final List<ParseTreeNode> children;

	public ParseTreeNode(String id, String label, boolean terminal, List<ParseTreeNode> children) {
		this.id = id;
		this.label = label;
		this.terminal = terminal;
		this.children = Collections.unmodifiableList(new ArrayList<>(children));
	}

	public boolean isLeaf(){
		return children.isEmpty();
	}

	/**
	 * Labels of all leaves from left to right, including unexpanded non terminals but without epsilon
	 */
	public List<String> leaves(){
		List<String> ret = new ArrayList<>();
		collectLeaves(ret);
		return ret;
	}

	private void collectLeaves(List<String> acc){
		if (isLeaf()){
			if (!label.equals(Epsilon.VALUE)){
				acc.add(label);
			}
			return;
		}
		for (ParseTreeNode child : children){
			child.collectLeaves(acc);
		}
	}

	/**
	 * Number of nodes on the longest path from this node to a leaf, a leaf has depth 1
	 */
	public int depth(){
		int max = 0;
		for (ParseTreeNode child : children){
			max = Math.max(max, child.depth());
		}
		return max + 1;
	}

	public int size(){
		int ret = 1;
		for (ParseTreeNode child : children){
			ret += child.size();
		}
		return ret;
	}

	/**
	 * Formats the tree in a bracket notation, like <code>S(a S(ε) b)</code>
	 */
	@Override
	public String toString() {
		if (isLeaf()){
			return label;
		}
		List<String> childStrings = new ArrayList<>();
		for (ParseTreeNode child : children){
			childStrings.add(child.toString());
		}
		return label + "(" + join(childStrings, " ") + ")";
	}
}
