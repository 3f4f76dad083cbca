package io.scopebind.core.engine;

import io.scopebind.core.model.Prop;
import io.scopebind.core.model.Resource;
import io.scopebind.core.model.StoreCollection;
import io.scopebind.core.model.Variable;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * The mutable views handed to a {@link TransactionMutator}. Only the collections the transaction
 * was opened for are accessible; asking for any other one fails.
 *
 * <p>
 * Not thread-safe: confined to the mutator.
 */
public final class Transaction {

    private final Map<StoreCollection, MutableCollection<?>> views = new EnumMap<>(StoreCollection.class);

    Transaction(StoreSnapshot base, Set<StoreCollection> collections) {
        for (StoreCollection collection : collections) {
            switch (collection) {
                case VARIABLES -> views.put(collection, new MutableCollection<Variable>(collection, base.variables(), Variable::id));
                case RESOURCES -> views.put(collection, new MutableCollection<Resource>(collection, base.resources(), Resource::id));
                case PROPS -> views.put(collection, new MutableCollection<Prop>(collection, base.props(), Prop::id));
            }
        }
    }

    /** Mutable view of the variables. */
    @SuppressWarnings("unchecked")
    public MutableCollection<Variable> variables() {
        return (MutableCollection<Variable>) view(StoreCollection.VARIABLES);
    }

    /** Mutable view of the resources. */
    @SuppressWarnings("unchecked")
    public MutableCollection<Resource> resources() {
        return (MutableCollection<Resource>) view(StoreCollection.RESOURCES);
    }

    /** Mutable view of the props. */
    @SuppressWarnings("unchecked")
    public MutableCollection<Prop> props() {
        return (MutableCollection<Prop>) view(StoreCollection.PROPS);
    }

    Map<StoreCollection, MutableCollection<?>> views() {
        return views;
    }

    void close() {
        views.values().forEach(MutableCollection::close);
    }

    private MutableCollection<?> view(StoreCollection collection) {
        MutableCollection<?> view = views.get(collection);
        if (view == null) {
            throw new IllegalStateException(
                    "Transaction was not opened for collection '" + collection.collectionName() + "'");
        }
        return view;
    }
}
