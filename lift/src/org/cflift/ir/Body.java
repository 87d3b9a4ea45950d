/*
 *  This file is part of the Jikes RVM project (http://jikesrvm.org).
 *
 *  This file is licensed to You under the Eclipse Public License (EPL);
 *  You may not use this file except in compliance with the License. You
 *  may obtain a copy of the License at
 *
 *      http://www.opensource.org/licenses/eclipse-1.0.php
 *
 *  See the COPYRIGHT.txt file distributed with this work for information
 *  regarding copyright ownership.
 */
package org.cflift.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of basic blocks nested in an operation.  The first
 * block is the entry; its parameters are the body's arguments.
 * <p>
 * Every change to the block list or to a terminator bumps a modification
 * stamp, which analyses use to decide whether cached results are stale.
 */
public final class Body {
  private final ArrayList<BasicBlock> blocks = new ArrayList<BasicBlock>();
  private Operation parentOp;
  private int modificationCount;

  public Operation getParentOp() {
    return parentOp;
  }

  /**
   * Set the operation this body is nested in.  A working copy of a body
   * may point at the original's parent without being one of its bodies.
   *
   * @param op the parent operation
   */
  public void setParentOp(Operation op) {
    this.parentOp = op;
  }

  public int getModificationCount() {
    return modificationCount;
  }

  void touch() {
    modificationCount++;
  }

  //----------------------------------------------------------------------//
  //                         Blocks.                                      //
  //----------------------------------------------------------------------//

  public BasicBlock getEntry() {
    return blocks.isEmpty() ? null : blocks.get(0);
  }

  public List<BasicBlock> getBlocks() {
    return Collections.unmodifiableList(blocks);
  }

  public int size() {
    return blocks.size();
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }

  public boolean contains(BasicBlock b) {
    return b.getBody() == this;
  }

  public int indexOf(BasicBlock b) {
    for (int i = 0; i < blocks.size(); i++) {
      if (blocks.get(i) == b) return i;
    }
    return -1;
  }

  public void addBlock(BasicBlock b) {
    insertBlock(blocks.size(), b);
  }

  public void insertBlock(int index, BasicBlock b) {
    if (b.getBody() != null) {
      throw new IllegalStateException(b + " already belongs to a body");
    }
    blocks.add(index, b);
    b.setBody(this);
    touch();
  }

  public void removeBlock(BasicBlock b) {
    int i = indexOf(b);
    if (i < 0) {
      throw new IllegalStateException(b + " is not in this body");
    }
    blocks.remove(i);
    b.setBody(null);
    touch();
  }

  /**
   * Replace the blocks of this body with those of another body, which is
   * left empty.  The blocks of this body are erased.
   *
   * @param other the donor
   */
  public void takeBlocksFrom(Body other) {
    dropAllReferences();
    for (BasicBlock b : blocks) {
      b.setBody(null);
    }
    blocks.clear();
    for (BasicBlock b : new ArrayList<BasicBlock>(other.blocks)) {
      other.removeBlock(b);
      addBlock(b);
    }
  }

  /**
   * @param target a block of this body
   * @return every block with an edge to target, once per edge
   */
  public List<BasicBlock> getPredecessors(BasicBlock target) {
    ArrayList<BasicBlock> preds = new ArrayList<BasicBlock>();
    for (BasicBlock b : blocks) {
      for (BasicBlock s : b.getSuccessors()) {
        if (s == target) preds.add(b);
      }
    }
    return preds;
  }

  //----------------------------------------------------------------------//
  //                         Traversal and lifetime.                      //
  //----------------------------------------------------------------------//

  /**
   * Visit every operation in this body and everything nested in it.
   *
   * @param visitor the visitor
   */
  public void walk(OperationVisitor visitor) {
    for (BasicBlock b : new ArrayList<BasicBlock>(blocks)) {
      b.walk(visitor);
    }
  }

  /**
   * Drop every use held by operations of this body, so that values defined
   * outside stop seeing them.
   */
  public void dropAllReferences() {
    for (BasicBlock b : blocks) {
      b.dropAllReferences();
    }
  }

  /**
   * Deep-copy this body.  The copy has no parent operation.
   *
   * @param mapping filled with the correspondence of blocks and values
   * @return the copy
   */
  public Body clone(final IRMapping mapping) {
    Body copy = new Body();
    for (BasicBlock b : blocks) {
      BasicBlock nb = new BasicBlock(b.getLabel());
      mapping.map(b, nb);
      for (BlockParameter p : b.getParameters()) {
        mapping.map(p, nb.addParameter(p.getType()));
      }
      copy.addBlock(nb);
    }
    for (BasicBlock b : blocks) {
      BasicBlock nb = mapping.lookup(b);
      for (Operation op : b.getOperations()) {
        nb.appendOperation(op.clone(mapping));
      }
      if (b.getTerminator() != null) {
        nb.setTerminator((Terminator) b.getTerminator().clone(mapping));
      }
    }
    // operands defined by a later block in list order were copied unmapped
    copy.walk(new OperationVisitor() {
      @Override
      public void visit(Operation op) {
        op.remapOperands(mapping);
      }
    });
    return copy;
  }
}
