package io.dispatcher.spring.boot;

import io.dispatcher.EventHandler;
import io.dispatcher.InvalidHandlerException;
import io.dispatcher.Subscription;
import io.dispatcher.dispatch.Dispatcher;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link EventSubscriber} and subscribes them to the
 * {@link Dispatcher}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see EventSubscriber
 */
public class EventSubscriberRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(EventSubscriberRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final Dispatcher dispatcher;
    private final List<String> codes = new ArrayList<>();

    public EventSubscriberRegistrar(ListableBeanFactory beanFactory, Dispatcher dispatcher) {
        this.beanFactory = beanFactory;
        this.dispatcher = dispatcher;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(EventSubscriber.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @EventSubscriber must implement EventHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation on the bean class itself
            EventSubscriber annotation = AnnotationUtils.findAnnotation(bean.getClass(), EventSubscriber.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @EventSubscriber annotation on " + bean.getClass().getName());
            }

            EventHandler subscribed = annotation.name().isEmpty()
                    ? handler : EventHandler.named(annotation.name(), handler);
            String eventCode = annotation.event().isEmpty() ? Subscription.ANY_EVENT : annotation.event();
            String namespace = annotation.namespace().isEmpty()
                    ? dispatcher.defaultNamespace() : annotation.namespace();

            try {
                codes.add(dispatcher.subscribe(eventCode, subscribed, namespace,
                        annotation.persistent(), annotation.priority()));
            } catch (IllegalArgumentException | InvalidHandlerException e) {
                throw new BeanCreationException(beanName, "Invalid @EventSubscriber: " + e.getMessage(), e);
            }
            logger.fine("Subscribed bean '" + beanName + "' to event '" + eventCode
                    + "' in namespace '" + namespace + "'");
        }
    }

    /**
     * Returns the codes of the subscriptions this registrar created.
     */
    public List<String> subscriptionCodes() {
        return Collections.unmodifiableList(codes);
    }
}
