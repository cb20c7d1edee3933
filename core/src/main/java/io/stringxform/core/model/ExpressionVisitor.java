package io.stringxform.core.model;

/**
 * Exhaustive dispatch over the {@link Expression} variants. Adding a variant to the sealed
 * hierarchy adds a method here, so every visitor has to handle it.
 *
 * @param <R> result type
 */
public interface ExpressionVisitor<R> {

    R visitConstStr(Expression.ConstStr expression);

    R visitSubStr(Expression.SubStr expression);

    R visitGetSpan(Expression.GetSpan expression);

    R visitCompose(Expression.Compose expression);

    R visitToCase(Expression.ToCase expression);

    R visitReplace(Expression.Replace expression);

    R visitTrim(Expression.Trim expression);

    R visitGetUpto(Expression.GetUpto expression);

    R visitGetFrom(Expression.GetFrom expression);

    R visitGetFirst(Expression.GetFirst expression);

    R visitGetAll(Expression.GetAll expression);

    R visitGetToken(Expression.GetToken expression);
}
