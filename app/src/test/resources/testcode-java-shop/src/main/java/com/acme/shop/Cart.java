package com.acme.shop;

import java.util.ArrayList;
import java.util.List;
import com.acme.util.Strings;
import org.slf4j.*;

/** A cart. */
@Deprecated
public class Cart extends Base implements Comparable<Cart>, Serializable {
    private final List<String> items = new ArrayList<>();
    int count, limit;

    public Cart() {
        init();
    }

    /** Adds an item. */
    @Override
    public void add(String item) {
        items.add(Strings.trim(item));
    }

    enum State {
        OPEN,
        CLOSED
    }

    interface Listener extends java.util.EventListener {
        void changed(Cart cart);
    }
}
