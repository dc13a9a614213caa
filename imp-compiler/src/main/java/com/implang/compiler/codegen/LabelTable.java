package com.implang.compiler.codegen;

import imp.runtime.bytecode.BytecodeBuffer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 标签与回填表
 *
 * <p>引用尚未放置的标签时写入 4 字节零占位并记录偏移；放置标签时回填所有记录的偏移。
 * 每个标签只能放置一次，翻译结束时不得残留待回填项。</p>
 */
public final class LabelTable {

    private int nextId = 0;
    private final Map<Label, Integer> addresses = new HashMap<>();
    private final Map<Label, List<Integer>> fixups = new HashMap<>();

    public Label newLabel() {
        return new Label(++nextId);
    }

    /**
     * 在缓冲区当前写入位置放置标签
     *
     * @return 标签地址
     */
    public int place(Label label, BytecodeBuffer buffer) {
        if (addresses.containsKey(label)) {
            throw new IllegalStateException("Label " + label + " placed twice");
        }
        int address = buffer.position();
        List<Integer> pending = fixups.remove(label);
        if (pending != null) {
            for (int offset : pending) {
                buffer.patchInt(offset, address);
            }
        }
        addresses.put(label, address);
        return address;
    }

    /**
     * 写入标签地址；地址未知时写入占位并登记回填
     */
    public void reference(Label label, BytecodeBuffer buffer) {
        Integer address = addresses.get(label);
        if (address != null) {
            buffer.writeInt(address);
        } else {
            fixups.computeIfAbsent(label, k -> new ArrayList<>()).add(buffer.position());
            buffer.writeInt(0);
        }
    }

    public boolean isPlaced(Label label) {
        return addresses.containsKey(label);
    }

    /** 已放置标签的地址，未放置返回 -1 */
    public int addressOf(Label label) {
        Integer address = addresses.get(label);
        return address != null ? address : -1;
    }

    /** 待回填的偏移总数 */
    public int pendingFixups() {
        int count = 0;
        for (List<Integer> offsets : fixups.values()) {
            count += offsets.size();
        }
        return count;
    }

    /**
     * 确认所有被引用的标签都已放置
     */
    public void checkResolved() {
        if (!fixups.isEmpty()) {
            throw new IllegalStateException("Unplaced labels with pending fixups: " + fixups.keySet());
        }
    }
}
