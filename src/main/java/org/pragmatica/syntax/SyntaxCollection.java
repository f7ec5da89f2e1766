package org.pragmatica.syntax;

import com.google.common.collect.ImmutableList;

import java.util.Iterator;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base of list-like views. Elements are always present; editing returns a new collection
 * of the same kind, sharing every untouched element.
 *
 * @param <E> element view type
 * @param <S> concrete collection type returned by editors
 */
public abstract sealed class SyntaxCollection<E extends Syntax, S extends SyntaxCollection<E, S>> extends Syntax
    implements Iterable<E>
    permits UnknownSyntax,
            DeclMembersSyntax,
            StmtListSyntax,
            TypeAttributesSyntax,
            BalancedTokensSyntax,
            TupleTypeElementListSyntax,
            TypeArgumentListSyntax,
            GenericParameterListSyntax,
            GenericArgumentListSyntax,
            GenericRequirementListSyntax {
    private final Class<E> elementType;
    private final Class<S> selfType;

    SyntaxCollection(RawLayout raw, Syntax parent, int indexInParent, Class<E> elementType, Class<S> selfType) {
        super(raw, parent, indexInParent);
        this.elementType = elementType;
        this.selfType = selfType;
    }

    public int size() {
        return childCount();
    }

    public boolean isEmpty() {
        return childCount() == 0;
    }

    public E get(int index) {
        return requiredChild(index, elementType);
    }

    public ImmutableList<E> elements() {
        var builder = ImmutableList.<E>builderWithExpectedSize(size());
        for (var i = 0; i < size(); i++) {
            builder.add(get(i));
        }
        return builder.build();
    }

    public Stream<E> stream() {
        return elements().stream();
    }

    @Override
    public Iterator<E> iterator() {
        return elements().iterator();
    }

    public S appending(E element) {
        return inserting(size(), element);
    }

    public S prepending(E element) {
        return inserting(0, element);
    }

    public S inserting(int index, E element) {
        checkNotNull(element, "element");
        return selfType.cast(replacingSelf(layout().inserting(index, element.raw())));
    }

    public S replacing(int index, E element) {
        return selfType.cast(withChild(index, element));
    }

    public S removing(int index) {
        return selfType.cast(replacingSelf(layout().removing(index)));
    }
}
